package com.flagship.member_payments.invoice;

import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.member.MemberProfile;
import com.flagship.member_payments.payment.Payment;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders an invoice as a standalone HTML document: seller and buyer details,
 * the line item, tax summary, total and amount in words.
 */
@Component
public class InvoiceRenderer {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    private final MoneyFormatter moneyFormatter;
    private final ZoneId zone;
    private final String sellerName;
    private final String sellerAddress;
    private final String sellerGstin;
    private final String sellerPan;

    public InvoiceRenderer(MoneyFormatter moneyFormatter,
                           @Value("${documents.numbering.zone:Asia/Kolkata}") String zone,
                           @Value("${documents.seller.name:India Angel Forum}") String sellerName,
                           @Value("${documents.seller.address:}") String sellerAddress,
                           @Value("${documents.seller.gstin:}") String sellerGstin,
                           @Value("${documents.seller.pan:}") String sellerPan) {
        this.moneyFormatter = moneyFormatter;
        this.zone = ZoneId.of(zone);
        this.sellerName = sellerName;
        this.sellerAddress = sellerAddress;
        this.sellerGstin = sellerGstin;
        this.sellerPan = sellerPan;
    }

    public byte[] render(Invoice invoice, Payment payment, MemberProfile member) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>");
        html.append("<html><head><meta charset=\"UTF-8\"><title>Invoice ")
            .append(esc(invoice.getInvoiceNumber())).append("</title><style>");
        html.append("body { font-family: Arial, sans-serif; color: #333; margin: 40px; }");
        html.append("h1 { text-align: center; letter-spacing: 2px; }");
        html.append("table { width: 100%; border-collapse: collapse; margin: 20px 0; }");
        html.append("th, td { padding: 8px; border-bottom: 1px solid #ddd; text-align: left; }");
        html.append("td.amount, th.amount { text-align: right; }");
        html.append(".total { font-weight: bold; font-size: 1.1em; }");
        html.append("</style></head><body>");

        html.append("<h1>INVOICE</h1>");
        html.append("<div class=\"seller\"><strong>").append(esc(sellerName)).append("</strong><br>")
            .append(esc(sellerAddress)).append("<br>GST: ").append(esc(sellerGstin))
            .append("<br>PAN: ").append(esc(sellerPan)).append("</div>");
        html.append("<p>Invoice No: ").append(esc(invoice.getInvoiceNumber())).append("<br>Date: ")
            .append(DATE.format((invoice.getIssuedAt() != null ? invoice.getIssuedAt() : invoice.getCreatedAt())
                .atZone(zone)))
            .append("</p>");

        html.append("<h3>Bill To</h3><p>");
        if (member != null) {
            html.append(esc(member.getFullName())).append("<br>").append(esc(member.getEmail()));
            if (member.getAddress() != null) {
                html.append("<br>").append(esc(member.getAddress()));
            }
            if (member.getPan() != null) {
                html.append("<br>PAN: ").append(esc(member.getPan()));
            }
        } else {
            html.append("Member ").append(invoice.getUserId());
        }
        html.append("</p>");

        html.append("<table><thead><tr><th>Description</th><th>Type</th><th class=\"amount\">Amount</th></tr></thead>");
        html.append("<tbody><tr><td>")
            .append(esc(payment.getDescription() != null ? payment.getDescription() : "Payment"))
            .append("</td><td>").append(payment.getType()).append("</td><td class=\"amount\">")
            .append(money(invoice.getSubtotal(), invoice)).append("</td></tr></tbody></table>");

        html.append("<table class=\"tax\">");
        row(html, "Subtotal", money(invoice.getSubtotal(), invoice));
        if (invoice.getCgst() > 0) {
            row(html, "CGST", money(invoice.getCgst(), invoice));
            row(html, "SGST", money(invoice.getSgst(), invoice));
        }
        if (invoice.getIgst() > 0) {
            row(html, "IGST", money(invoice.getIgst(), invoice));
        }
        if (invoice.getTds() > 0) {
            row(html, "TDS", money(invoice.getTds(), invoice));
        }
        html.append("<tr class=\"total\"><td>Total</td><td class=\"amount\">")
            .append(money(invoice.getTotalAmount(), invoice)).append("</td></tr>");
        html.append("</table>");

        html.append("<p>Amount in words: ")
            .append(esc(AmountInWords.of(invoice.getTotalAmount(), invoice.getCurrency()))).append("</p>");
        html.append("<p>Payment reference: ").append(esc(payment.getGatewayPaymentId())).append("</p>");
        html.append("<hr><p style=\"color: #888; font-size: 0.9em;\">This is a computer-generated invoice. ")
            .append("Thank you for being a member of ").append(esc(sellerName)).append(".</p>");
        html.append("</body></html>");
        return html.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String money(long amount, Invoice invoice) {
        return esc(moneyFormatter.format(amount, invoice.getCurrency()));
    }

    private static void row(StringBuilder html, String label, String value) {
        html.append("<tr><td>").append(label).append("</td><td class=\"amount\">").append(value).append("</td></tr>");
    }

    private static String esc(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
