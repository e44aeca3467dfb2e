package com.funnelforge.core.model;

/**
 * Well-known keys in {@link Task#payload()}.
 */
public final class PayloadKeys {

    private PayloadKeys() {}

    public static final String ARM_ID = "armId";
    public static final String PLATFORM = "platform";
    public static final String HOOK_TYPE = "hookType";
    public static final String TEMPLATE_STYLE = "templateStyle";
    public static final String PARENT_TASK_ID = "parentTaskId";

    public static final String TITLE = "title";
    public static final String SCRIPT = "script";
    public static final String ESTIMATED_ENGAGEMENT = "estimatedEngagement";

    public static final String VIDEO_URL = "videoUrl";
    public static final String THUMBNAIL_URL = "thumbnailUrl";
    public static final String RENDER_STATUS = "renderStatus";

    public static final String COMPLIANCE_SEVERITY = "complianceSeverity";
    public static final String COMPLIANCE_VIOLATIONS = "complianceViolations";

    public static final String CONTENT_ID = "contentId";

    public static final String APPROVED = "approved";
    public static final String APPROVED_BY = "approvedBy";
}
