package com.flagship.member_payments.statement;

import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.member.MemberProfile;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders a financial statement as HTML. DETAILED adds the transaction table
 * below the summary.
 */
@Component
public class StatementRenderer {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    private final MoneyFormatter moneyFormatter;
    private final ZoneId zone;
    private final String sellerName;

    public StatementRenderer(MoneyFormatter moneyFormatter,
                             @Value("${documents.numbering.zone:Asia/Kolkata}") String zone,
                             @Value("${documents.seller.name:India Angel Forum}") String sellerName) {
        this.moneyFormatter = moneyFormatter;
        this.zone = ZoneId.of(zone);
        this.sellerName = sellerName;
    }

    public byte[] render(FinancialStatement statement, StatementTotals totals, MemberProfile member,
                         Instant generatedAt) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>");
        html.append("<html><head><meta charset=\"UTF-8\"><title>Statement ")
            .append(esc(statement.getStatementNumber())).append("</title><style>");
        html.append("body { font-family: Arial, sans-serif; color: #333; margin: 40px; }");
        html.append("h1, h2 { text-align: center; }");
        html.append("table { width: 100%; border-collapse: collapse; margin: 20px 0; }");
        html.append("th, td { padding: 8px; border-bottom: 1px solid #ddd; text-align: left; }");
        html.append("td.amount, th.amount { text-align: right; }");
        html.append(".net { font-weight: bold; }");
        html.append("</style></head><body>");

        html.append("<h1>").append(esc(sellerName)).append("</h1>");
        html.append("<h2>Financial Statement</h2>");
        html.append("<p>Statement Number: ").append(esc(statement.getStatementNumber()))
            .append("<br>Period: ").append(DATE.format(statement.getDateFrom()))
            .append(" - ").append(DATE.format(statement.getDateTo()))
            .append("<br>Generated On: ").append(DATE.format(generatedAt.atZone(zone)))
            .append("</p>");

        if (member != null) {
            html.append("<p>Name: ").append(esc(member.getFullName()))
                .append("<br>Email: ").append(esc(member.getEmail())).append("</p>");
        }

        html.append("<h3>Summary</h3><table>");
        row(html, "Total Invested", money(totals.getTotalInvested(), statement));
        row(html, "Total Refunded", money(totals.getTotalRefunded(), statement));
        row(html, "Total Tax (GST + TDS)", money(totals.getTotalTax(), statement));
        html.append("<tr class=\"net\"><td>Net Investment</td><td class=\"amount\">")
            .append(money(totals.getNetInvestment(), statement)).append("</td></tr>");
        row(html, "Transactions", String.valueOf(totals.getTransactionCount()));
        html.append("</table>");

        if (statement.getFormat() == StatementFormat.DETAILED) {
            html.append("<h3>Transactions</h3>");
            if (totals.getLines().isEmpty()) {
                html.append("<p>No completed payments in this period.</p>");
            } else {
                html.append("<table><thead><tr><th>Date</th><th>Type</th><th>Description</th>")
                    .append("<th>Reference</th><th class=\"amount\">Amount</th><th class=\"amount\">Tax</th>")
                    .append("</tr></thead><tbody>");
                for (StatementLine line : totals.getLines()) {
                    html.append("<tr><td>").append(DATE.format(line.getCompletedAt().atZone(zone)))
                        .append("</td><td>").append(line.getType())
                        .append("</td><td>").append(esc(line.getDescription()))
                        .append("</td><td>").append(esc(line.getGatewayPaymentId()))
                        .append("</td><td class=\"amount\">").append(money(line.getAmount(), statement))
                        .append("</td><td class=\"amount\">").append(money(line.getTax(), statement))
                        .append("</td></tr>");
                }
                html.append("</tbody></table>");
            }
        }

        html.append("<hr><p style=\"color: #888; font-size: 0.9em;\">")
            .append("Tax is shown at the flat composite rate applied to the period total. ")
            .append("This is a computer-generated statement.</p>");
        html.append("</body></html>");
        return html.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String money(long amount, FinancialStatement statement) {
        return esc(moneyFormatter.format(amount, statement.getCurrency()));
    }

    private static void row(StringBuilder html, String label, String value) {
        html.append("<tr><td>").append(label).append("</td><td class=\"amount\">").append(value).append("</td></tr>");
    }

    private static String esc(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
