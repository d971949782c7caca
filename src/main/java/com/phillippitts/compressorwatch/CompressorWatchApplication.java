package com.phillippitts.compressorwatch;

import com.phillippitts.compressorwatch.config.properties.AlertProperties;
import com.phillippitts.compressorwatch.config.properties.MonitoringProperties;
import com.phillippitts.compressorwatch.config.properties.ScorerProperties;
import com.phillippitts.compressorwatch.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ScorerProperties.class,
        AlertProperties.class,
        MonitoringProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class CompressorWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompressorWatchApplication.class, args);
    }

}
