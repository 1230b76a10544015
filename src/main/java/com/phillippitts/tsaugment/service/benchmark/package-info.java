/**
 * Qualitative comparison of series (dynamic time warping).
 */
package com.phillippitts.tsaugment.service.benchmark;
