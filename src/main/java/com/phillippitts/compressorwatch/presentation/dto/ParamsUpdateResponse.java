package com.phillippitts.compressorwatch.presentation.dto;

import java.util.Map;

/**
 * @param applied fields that passed validation and were stored
 * @param params  full parameter set after the update
 */
public record ParamsUpdateResponse(Map<String, Double> applied, Map<String, Double> params) {
}
