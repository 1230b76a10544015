/**
 * Composition of augmenters: ordered pipelines and probabilistic gating.
 */
package com.phillippitts.tsaugment.service.pipeline;
