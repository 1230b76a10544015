/**
 * Augmentation engine services.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.augment} - augmenter contract, batch execution and construction from configuration</li>
 *   <li>{@code service.augment.impl} - augmenter variants</li>
 *   <li>{@code service.pipeline} - pipelines and conditional gating</li>
 *   <li>{@code service.transform} - FFT and DCT over datasets</li>
 *   <li>{@code service.benchmark} - dynamic time warping</li>
 * </ul>
 *
 * @see com.phillippitts.tsaugment.service.AugmentationService
 */
package com.phillippitts.tsaugment.service;
