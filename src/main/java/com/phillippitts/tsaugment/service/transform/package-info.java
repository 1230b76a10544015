/**
 * Frequency-domain (DFT) and cosine-domain (DCT) transforms over datasets, with the
 * tolerance check used to verify their round trips.
 */
package com.phillippitts.tsaugment.service.transform;
