package dev.uimigrator.diagnostics;

/**
 * Stable diagnostic codes. Messages may change between releases, codes do not.
 */
public final class DiagnosticCodes {

    // Pipeline orchestration
    public static final String PIPELINE_EMPTY = "PIPELINE_EMPTY";
    public static final String PIPELINE_START = "PIPELINE_START";
    public static final String PIPELINE_STAGE = "PIPELINE_STAGE";
    public static final String PIPELINE_STAGE_FAILED = "PIPELINE_STAGE_FAILED";
    public static final String PIPELINE_COMPLETE = "PIPELINE_COMPLETE";
    public static final String PIPELINE_INTEGRITY_NO_ROOT = "PIPELINE_INTEGRITY_NO_ROOT";
    public static final String PIPELINE_INTEGRITY_CYCLE = "PIPELINE_INTEGRITY_CYCLE";
    public static final String PIPELINE_INTEGRITY_PARENT_MISMATCH = "PIPELINE_INTEGRITY_PARENT_MISMATCH";

    // Mode-adaptive transformers
    public static final String TRANSFORMER_START = "TRANSFORMER_START";
    public static final String TRANSFORMER_COMPLETE = "TRANSFORMER_COMPLETE";
    public static final String MISSING_STRUCTURAL_LAYER = "MISSING_STRUCTURAL_LAYER";
    public static final String MISSING_TYPED_LAYER = "MISSING_TYPED_LAYER";
    public static final String TYPED_VIEW_UNAVAILABLE = "TYPED_VIEW_UNAVAILABLE";
    public static final String VALIDATION_MISSING_TYPE = "VALIDATION_MISSING_TYPE";
    public static final String VALIDATION_MISSING_STRUCTURAL_ANCHOR = "VALIDATION_MISSING_STRUCTURAL_ANCHOR";
    public static final String VALIDATION_ISSUES = "VALIDATION_ISSUES";

    // Rule engine
    public static final String TRANSFORM_NO_ROOT = "TRANSFORM_NO_ROOT";
    public static final String TRANSFORM_ROOT_REMOVED = "TRANSFORM_ROOT_REMOVED";
    public static final String TRANSFORM_COMPLETE = "TRANSFORM_COMPLETE";
    public static final String TRANSFORM_RULE_STATS = "TRANSFORM_RULE_STATS";
    public static final String TYPE_RESOLUTION_FAILED = "TYPE_RESOLUTION_FAILED";

    // Restructuring
    public static final String UNSUPPORTED_CONDITION = "UNSUPPORTED_CONDITION";
    public static final String STYLE_NO_TARGET_TYPE = "STYLE_NO_TARGET_TYPE";
    public static final String RESTRUCTURE_NO_PARENT = "RESTRUCTURE_NO_PARENT";
    public static final String STYLE_KEYED = "STYLE_KEYED";
    public static final String STYLE_KEYED_TRIGGERS = "STYLE_KEYED_TRIGGERS";
    public static final String THEME_REFERENCE_EXTERNAL = "THEME_REFERENCE_EXTERNAL";
    public static final String EVENT_TRIGGER_UNSUPPORTED = "EVENT_TRIGGER_UNSUPPORTED";

    // Element and property rules
    public static final String TYPE_MANUAL_REVIEW = "TYPE_MANUAL_REVIEW";
    public static final String PROPERTY_MANUAL_REVIEW = "PROPERTY_MANUAL_REVIEW";
    public static final String PROPERTY_UNSUPPORTED = "PROPERTY_UNSUPPORTED";
    public static final String PAGE_NAVIGATION_REMOVED = "PAGE_NAVIGATION_REMOVED";
    public static final String LISTVIEW_VIEW_REMOVED = "LISTVIEW_VIEW_REMOVED";
    public static final String VISIBILITY_BINDING = "VISIBILITY_BINDING";
    public static final String VISIBILITY_HIDDEN = "VISIBILITY_HIDDEN";
    public static final String CURSOR_APPROXIMATED = "CURSOR_APPROXIMATED";

    // Templates
    public static final String CONTROL_TEMPLATE_NO_TARGET_TYPE = "CONTROL_TEMPLATE_NO_TARGET_TYPE";
    public static final String CONTROL_TEMPLATE_TRIGGERS = "CONTROL_TEMPLATE_TRIGGERS";
    public static final String DATA_TEMPLATE_TRIGGERS = "DATA_TEMPLATE_TRIGGERS";
    public static final String HIERARCHICAL_DATA_TEMPLATE = "HIERARCHICAL_DATA_TEMPLATE";

    // Markup extensions
    public static final String XARRAY_NOT_SUPPORTED = "XARRAY_NOT_SUPPORTED";
    public static final String XSTATIC_NO_MEMBER = "XSTATIC_NO_MEMBER";
    public static final String XTYPE_NO_TYPE = "XTYPE_NO_TYPE";
    public static final String BINDING_TEMPLATED_PARENT = "BINDING_TEMPLATED_PARENT";
    public static final String BINDING_RELATIVE_SOURCE_UNSUPPORTED = "BINDING_RELATIVE_SOURCE_UNSUPPORTED";
    public static final String MULTIBINDING_CONVERTER = "MULTIBINDING_CONVERTER";

    // Reading and writing
    public static final String PARSE_FAILED = "PARSE_FAILED";
    public static final String WRITE_FAILED = "WRITE_FAILED";

    private DiagnosticCodes() {
    }
}
