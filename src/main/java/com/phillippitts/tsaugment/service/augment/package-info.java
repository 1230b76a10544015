/**
 * The augmenter contract and the machinery shared by all variants: batch execution settings,
 * the row fan-out runner, per-row random state and construction from configuration.
 */
package com.phillippitts.tsaugment.service.augment;
