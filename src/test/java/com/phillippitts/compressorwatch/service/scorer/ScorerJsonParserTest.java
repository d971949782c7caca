package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.exception.ScorerOutputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScorerJsonParserTest {

    @Test
    void parsesFullConsensusRecord() {
        String out = "{\"success\":true,\"isAnomaly\":true,\"confidence\":0.82,\"anomalyScore\":0.77,"
                + "\"anomalyType\":\"valve_leak\",\"reliability\":0.9,"
                + "\"consensusInfo\":{\"consensusRate\":0.66},\"message\":\"fused\"}";

        ScorerResponse r = ScorerJsonParser.parse(out, "consensus", ScorerCommand.DETECT);

        assertThat(r.success()).isTrue();
        assertThat(r.anomalous()).isTrue();
        assertThat(r.anomalyType()).isEqualTo("valve_leak");
        assertThat(r.reliability()).isEqualTo(0.9);
        assertThat(r.consensusRate()).isEqualTo(0.66);
        assertThat(r.message()).isEqualTo("fused");
    }

    @Test
    void usesLastJsonLineWhenProgressIsPrinted() {
        String out = "Loading model from data/models/phase1/\n"
                + "{\"partial\": true\n"
                + "{\"success\":true,\"isAnomaly\":false,\"confidence\":0.4}\n";

        ScorerResponse r = ScorerJsonParser.parse(out, "baseline", ScorerCommand.DETECT);

        assertThat(r.success()).isTrue();
        assertThat(r.confidence()).isEqualTo(0.4);
    }

    @Test
    void clampsOutOfRangeNumbersAndDefaultsTypes() {
        String out = "{\"success\":true,\"isAnomaly\":true,\"confidence\":1.7,\"anomalyScore\":-0.2}";

        ScorerResponse r = ScorerJsonParser.parse(out, "baseline", ScorerCommand.DETECT);

        assertThat(r.confidence()).isEqualTo(1.0);
        assertThat(r.anomalyScore()).isEqualTo(0.0);
        assertThat(r.anomalyType()).isEqualTo("anomaly");
        assertThat(r.reliability()).isNull();
        assertThat(r.consensusRate()).isNull();
    }

    @Test
    void normalDecisionWithoutTypeIsLabelledNormal() {
        ScorerResponse r = ScorerJsonParser.parse("{\"success\":true,\"isAnomaly\":false}", "baseline",
                ScorerCommand.DETECT);

        assertThat(r.anomalyType()).isEqualTo("normal");
    }

    @Test
    void blankOutputIsRejected() {
        assertThatThrownBy(() -> ScorerJsonParser.parse("  ", "adaptive", ScorerCommand.FORCE_UPDATE))
                .isInstanceOf(ScorerOutputException.class)
                .hasMessageContaining("Malformed scorer output")
                .hasMessageContaining("command=force_update");
    }

    @Test
    void nonJsonOutputIsRejectedWithSnippet() {
        assertThatThrownBy(() -> ScorerJsonParser.parse("Segmentation fault", "adaptive", ScorerCommand.DETECT))
                .isInstanceOf(ScorerOutputException.class)
                .hasMessageContaining("output=Segmentation fault");
    }
}
