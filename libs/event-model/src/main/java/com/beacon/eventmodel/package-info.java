/**
 * Canonical event model: the {@link com.beacon.eventmodel.CanonicalValue} tree, the five event
 * variants with their shared envelope, and the JSON codec.
 *
 * <p>Everything in this package is immutable. The {@link com.beacon.eventmodel.PayloadSerializer}
 * contract is the boundary to caller-supplied data.
 */
package com.beacon.eventmodel;
