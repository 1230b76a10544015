/**
 * Domain model: the {@link com.phillippitts.tsaugment.domain.Dataset} every engine component
 * operates on, plus immutable result records for transforms and alignment.
 */
package com.phillippitts.tsaugment.domain;
