/**
 * Augmenter variants. Every class validates its configuration on construction and never mutates
 * the series it is given.
 */
package com.phillippitts.tsaugment.service.augment.impl;
