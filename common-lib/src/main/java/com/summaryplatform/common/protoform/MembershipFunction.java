package com.summaryplatform.common.protoform;

/**
 * Maps a numeric value to the degree, in [0, 1], to which it satisfies a
 * linguistic predicate such as "increasing" or "most".
 */
@FunctionalInterface
public interface MembershipFunction {

    double degree(double value);
}
