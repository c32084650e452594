package com.summaryplatform.common.protoform;

/**
 * Membership of a whole point (or any other element) in a fuzzy set.
 *
 * @param <T> element type, usually a numeric point
 */
@FunctionalInterface
public interface PointMembershipFunction<T> {

    double degree(T point);
}
