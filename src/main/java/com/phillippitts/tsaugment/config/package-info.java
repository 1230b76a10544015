/**
 * Spring configuration: worker pool, bound properties and the configured pipeline.
 */
package com.phillippitts.tsaugment.config;
