package com.flagship.member_payments.statement;

import com.flagship.member_payments.common.CsvWriter;
import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.payment.CurrencyCode;
import com.flagship.member_payments.statement.dto.EmailStatementRequest;
import com.flagship.member_payments.statement.dto.EmailStatementResponse;
import com.flagship.member_payments.statement.dto.GenerateStatementRequest;
import com.flagship.member_payments.statement.dto.StatementResponse;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * Financial statement endpoints. The member comes from {@code X-User-Id},
 * set by the authentication layer in front of this service.
 */
@RestController
@RequestMapping("/api/financial-statements")
@Slf4j
public class StatementController {

    private static final String USER_ID_HEADER = "X-User-Id";
    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final StatementService statementService;
    private final MoneyFormatter moneyFormatter;
    private final Clock clock;
    private final ZoneId zone;

    public StatementController(StatementService statementService,
                               MoneyFormatter moneyFormatter,
                               Clock clock,
                               @Value("${documents.numbering.zone:Asia/Kolkata}") String zone) {
        this.statementService = statementService;
        this.moneyFormatter = moneyFormatter;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    @PostMapping
    public ResponseEntity<StatementResponse> generate(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                      @Valid @RequestBody GenerateStatementRequest request) {
        long startTime = System.currentTimeMillis();
        CurrencyCode currency = request.getCurrency() == null
            ? CurrencyCode.INR
            : CurrencyCode.fromCode(request.getCurrency());

        FinancialStatement statement = statementService.generate(
            userId, request.getDateFrom(), request.getDateTo(), request.getFormat(), currency);

        log.info("Statement {} requested by {} in {}ms",
                statement.getStatementNumber(), userId, System.currentTimeMillis() - startTime);
        return ResponseEntity.status(HttpStatus.CREATED).body(StatementResponse.from(statement));
    }

    @GetMapping
    public ResponseEntity<List<StatementResponse>> list(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam(value = "year", required = false) Integer year,
            @RequestParam(value = "month", required = false) Integer month,
            @RequestParam(value = "format", required = false) StatementFormat format) {
        return ResponseEntity.ok(statementService.list(userId, year, month, format).stream()
            .map(StatementResponse::from)
            .toList());
    }

    @GetMapping(value = "/export", produces = "text/csv")
    public ResponseEntity<String> export(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam(value = "year", required = false) Integer year,
            @RequestParam(value = "month", required = false) Integer month,
            @RequestParam(value = "format", required = false) StatementFormat format) {

        CsvWriter csv = CsvWriter.withHeader("Date", "Type", "Description", "Statement Number",
            "Period From", "Period To", "Status", "Total Invested", "Total Refunded", "Total Tax",
            "Net Investment", "Currency");
        for (FinancialStatement s : statementService.list(userId, year, month, format)) {
            csv.row(s.getCreatedAt().atZone(zone).toLocalDate(),
                s.getFormat(),
                "Financial statement " + s.getStatementNumber(),
                s.getStatementNumber(),
                s.getDateFrom(),
                s.getDateTo(),
                s.getStatus(),
                moneyFormatter.plain(s.getTotalInvested(), s.getCurrency()),
                moneyFormatter.plain(s.getTotalRefunded(), s.getCurrency()),
                moneyFormatter.plain(s.getTotalTax(), s.getCurrency()),
                moneyFormatter.plain(s.getNetInvestment(), s.getCurrency()),
                s.getCurrency());
        }
        return csv("statements-" + LocalDate.now(clock.withZone(zone)) + ".csv", csv);
    }

    @GetMapping("/{id}")
    public ResponseEntity<StatementResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(StatementResponse.from(statementService.get(id)));
    }

    @GetMapping(value = "/{id}/transactions.csv", produces = "text/csv")
    public ResponseEntity<String> transactions(@PathVariable("id") UUID id) {
        FinancialStatement statement = statementService.get(id);
        StatementTotals totals = statementService.lines(id);

        CsvWriter csv = CsvWriter.withHeader("Date", "Type", "Description", "Transaction ID",
            "Amount", "Tax", "Currency");
        for (StatementLine line : totals.getLines()) {
            csv.row(line.getCompletedAt().atZone(zone).toLocalDate(),
                line.getType(),
                line.getDescription(),
                line.getGatewayPaymentId(),
                moneyFormatter.plain(line.getAmount(), statement.getCurrency()),
                moneyFormatter.plain(line.getTax(), statement.getCurrency()),
                statement.getCurrency());
        }
        return csv(statement.getStatementNumber() + "-transactions.csv", csv);
    }

    @PostMapping("/{id}/email")
    public ResponseEntity<EmailStatementResponse> email(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody EmailStatementRequest request) {
        log.info("Email requested for statement {}", id);
        StatementEmailOutcome outcome = statementService.email(id, request.getTo(), request.getAdditionalEmails());
        return ResponseEntity.ok(EmailStatementResponse.from(outcome));
    }

    private static ResponseEntity<String> csv(String filename, CsvWriter csv) {
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
            .contentType(TEXT_CSV)
            .body(csv.toString());
    }
}
