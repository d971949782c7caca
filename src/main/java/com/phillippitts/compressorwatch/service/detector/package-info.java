/**
 * The three detector stages and their shared lifecycle.
 *
 * <p>Baseline must be trained before adaptive can initialize, and both must be ready before the
 * consensus engine can initialize. Detection never throws for scorer problems; it returns a
 * soft-failure result instead.
 */
package com.phillippitts.compressorwatch.service.detector;
