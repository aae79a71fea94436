package com.flagship.member_payments.notification;

/**
 * Email templates, each backed by {@code templates/email/<name>.html} on the classpath.
 * Subjects may carry {@code {{placeholders}}} too.
 */
public enum EmailTemplate {
    PAYMENT_INITIATED("payment-initiated", "Payment Order Created - India Angel Forum", NotificationCategory.PAYMENTS),
    PAYMENT_SUCCESS("payment-success", "Payment Successful - India Angel Forum", NotificationCategory.PAYMENTS),
    PAYMENT_FAILED("payment-failed", "Payment Failed - India Angel Forum", NotificationCategory.PAYMENTS),
    REFUND_PROCESSED("refund-processed", "Refund Processed - India Angel Forum", NotificationCategory.PAYMENTS),
    INVOICE_READY("invoice-ready", "Invoice {{invoiceNumber}} - India Angel Forum", NotificationCategory.PAYMENTS),
    STATEMENT_READY("statement-ready", "Financial Statement {{statementNumber}} - India Angel Forum",
        NotificationCategory.STATEMENTS),
    ADMIN_DIGEST("admin-digest", "Daily Admin Digest - {{date}} - India Angel Forum", NotificationCategory.SYSTEM);

    private final String templateName;
    private final String subject;
    private final NotificationCategory category;

    EmailTemplate(String templateName, String subject, NotificationCategory category) {
        this.templateName = templateName;
        this.subject = subject;
        this.category = category;
    }

    public String getTemplateName() {
        return templateName;
    }

    public String getSubject() {
        return subject;
    }

    public NotificationCategory getCategory() {
        return category;
    }
}
