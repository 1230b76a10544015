/**
 * Engine exception hierarchy.
 *
 * <p>Every failure the engine surfaces is a typed, unchecked exception rooted at
 * {@link com.phillippitts.tsaugment.exception.TsAugmentException}:
 * <ul>
 *   <li>{@link com.phillippitts.tsaugment.exception.ShapeMismatchException} - feature/label counts
 *       or row lengths disagree</li>
 *   <li>{@link com.phillippitts.tsaugment.exception.ConfigurationException} - invalid augmenter
 *       parameters, unknown names or enumeration values, out-of-range probabilities</li>
 *   <li>{@link com.phillippitts.tsaugment.exception.DimensionException} - a length-changing
 *       operation produced rows of different lengths</li>
 *   <li>{@link com.phillippitts.tsaugment.exception.PipelineCompatibilityException} - per-sample
 *       pipelining requested with a batch-only stage</li>
 *   <li>{@link com.phillippitts.tsaugment.exception.EmptySequenceException} - DTW on an empty
 *       sequence</li>
 *   <li>{@link com.phillippitts.tsaugment.exception.NonFiniteValueException} - NaN or infinite
 *       input where finite values are required</li>
 * </ul>
 *
 * <p>Nothing in the engine retries or swallows these; a failed call leaves the caller's dataset
 * exactly as it was before the call.
 *
 * @since 1.0
 */
package com.phillippitts.tsaugment.exception;
