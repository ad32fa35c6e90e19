package io.eskema.core.model;

/**
 * Stable expectation codes, named {@code domain.specific_issue}.
 *
 * <ul>
 * <li>{@code type.*} type guards</li>
 * <li>{@code value.*} checks on a primitive value</li>
 * <li>{@code structure.*} map and list traversal</li>
 * <li>{@code logic.*} combinator wrappers and misuse</li>
 * </ul>
 */
public final class ExpectationCodes {

    private ExpectationCodes() {}

    public static final String TYPE_MISMATCH = "type.mismatch";

    public static final String VALUE_LENGTH_OUT_OF_RANGE = "value.length_out_of_range";
    public static final String VALUE_RANGE_OUT_OF_BOUNDS = "value.range_out_of_bounds";
    public static final String VALUE_CONTAINS_MISSING = "value.contains_missing";
    public static final String VALUE_PATTERN_MISMATCH = "value.pattern_mismatch";
    public static final String VALUE_CASE_MISMATCH = "value.case_mismatch";
    public static final String VALUE_EQUAL_MISMATCH = "value.equal_mismatch";
    public static final String VALUE_DEEP_EQUAL_MISMATCH = "value.deep_equal_mismatch";
    public static final String VALUE_MEMBERSHIP_MISMATCH = "value.membership_mismatch";
    public static final String VALUE_DATE_OUT_OF_RANGE = "value.date_out_of_range";
    public static final String VALUE_DATE_MISMATCH = "value.date_mismatch";
    public static final String VALUE_DATE_NOT_PAST = "value.date_not_past";
    public static final String VALUE_DATE_NOT_FUTURE = "value.date_not_future";
    public static final String VALUE_FORMAT_INVALID = "value.format_invalid";

    public static final String STRUCTURE_MAP_FIELD_FAILED = "structure.map_field_failed";
    public static final String STRUCTURE_UNKNOWN_KEY = "structure.unknown_key";
    public static final String STRUCTURE_LIST_ITEM_FAILED = "structure.list_item_failed";

    public static final String LOGIC_NOT_EXPECTED = "logic.not_expected";
    public static final String LOGIC_PREDICATE_FAILED = "logic.predicate_failed";
    public static final String LOGIC_CONTEXTUAL_MISUSE = "logic.contextual_misuse";
}
