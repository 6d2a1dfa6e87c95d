package io.intellixity.frugal.access.query;

/** Calendar component compared by {@link Operator#DATE_PART_EQ}. */
public enum DatePart { YEAR, MONTH, DAY, DOW }
