package com.flagship.member_payments.statement;

import com.flagship.member_payments.activity.ActivityLogService;
import com.flagship.member_payments.activity.ActivityType;
import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.document.DocumentSequenceAllocator;
import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.event.StatementGeneratedEvent;
import com.flagship.member_payments.exception.ResourceNotFoundException;
import com.flagship.member_payments.member.MemberDirectory;
import com.flagship.member_payments.member.MemberProfile;
import com.flagship.member_payments.notification.DispatchResult;
import com.flagship.member_payments.notification.NotificationDispatcher;
import com.flagship.member_payments.notification.NotificationEventHandler;
import com.flagship.member_payments.outbox.OutboxService;
import com.flagship.member_payments.payment.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Financial statement requests, the GENERATING -> READY step and on-demand email.
 *
 * A request is validated, numbered and persisted GENERATING together with its
 * STATEMENT job in one transaction; the document itself is produced by
 * {@link StatementGenerator} on the worker pool.
 */
@Service
@Slf4j
public class StatementService {

    private final FinancialStatementRepository repository;
    private final StatementCalculator calculator;
    private final DocumentSequenceAllocator sequenceAllocator;
    private final GenerationQueueService queueService;
    private final MemberDirectory memberDirectory;
    private final OutboxService outboxService;
    private final ActivityLogService activityLogService;
    private final NotificationDispatcher dispatcher;
    private final NotificationEventHandler notificationEventHandler;
    private final MoneyFormatter moneyFormatter;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ZoneId zone;

    public StatementService(FinancialStatementRepository repository,
                            StatementCalculator calculator,
                            DocumentSequenceAllocator sequenceAllocator,
                            GenerationQueueService queueService,
                            MemberDirectory memberDirectory,
                            OutboxService outboxService,
                            ActivityLogService activityLogService,
                            NotificationDispatcher dispatcher,
                            NotificationEventHandler notificationEventHandler,
                            MoneyFormatter moneyFormatter,
                            PlatformTransactionManager transactionManager,
                            Clock clock,
                            @Value("${documents.numbering.zone:Asia/Kolkata}") String zone) {
        this.repository = repository;
        this.calculator = calculator;
        this.sequenceAllocator = sequenceAllocator;
        this.queueService = queueService;
        this.memberDirectory = memberDirectory;
        this.outboxService = outboxService;
        this.activityLogService = activityLogService;
        this.dispatcher = dispatcher;
        this.notificationEventHandler = notificationEventHandler;
        this.moneyFormatter = moneyFormatter;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    /**
     * Requests a statement for [dateFrom, dateTo].
     *
     * @throws IllegalArgumentException if the range is inverted or ends in the future
     * @throws ResourceNotFoundException if the member does not exist
     * @throws IllegalStateException if a statement already exists for the period and format
     */
    @Transactional
    public FinancialStatement generate(UUID userId, LocalDate dateFrom, LocalDate dateTo,
                                       StatementFormat format, CurrencyCode currency) {
        if (dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("dateFrom must not be after dateTo");
        }
        if (dateTo.isAfter(LocalDate.now(clock.withZone(zone)))) {
            throw new IllegalArgumentException("Statement period cannot end in the future");
        }
        if (memberDirectory.findMember(userId).isEmpty()) {
            throw ResourceNotFoundException.of("Member", userId);
        }
        if (repository.existsByUserIdAndDateFromAndDateToAndFormat(userId, dateFrom, dateTo, format)) {
            throw new IllegalStateException("Statement already exists for this period");
        }

        StatementTotals totals = calculator.calculate(userId, currency, dateFrom, dateTo);
        String number = sequenceAllocator.allocate(DocumentSequenceAllocator.STATEMENT_PREFIX);
        FinancialStatement statement = FinancialStatement.generating(
            number, userId, dateFrom, dateTo, format, currency, totals, clock.instant());

        FinancialStatementEntity saved = repository.saveAndFlush(FinancialStatementEntity.fromDomain(statement));
        queueService.enqueue(JobKind.STATEMENT, saved.getId());

        log.info("Requested {} statement {} for member {} ({} to {}), {} payments",
                format, number, userId, dateFrom, dateTo, totals.getTransactionCount());
        return saved.toDomain();
    }

    /**
     * @throws ResourceNotFoundException if no statement has that id
     */
    @Transactional(readOnly = true)
    public FinancialStatement get(UUID statementId) {
        return repository.findById(statementId)
            .map(FinancialStatementEntity::toDomain)
            .orElseThrow(() -> ResourceNotFoundException.of("Statement", statementId));
    }

    /**
     * Member's statements, newest period first. Year and month match the start of the period.
     */
    @Transactional(readOnly = true)
    public List<FinancialStatement> list(UUID userId, Integer year, Integer month, StatementFormat format) {
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("month must be between 1 and 12");
        }
        return repository.findByUserIdOrderByDateFromDescCreatedAtDesc(userId).stream()
            .map(FinancialStatementEntity::toDomain)
            .filter(s -> year == null || s.getDateFrom().getYear() == year)
            .filter(s -> month == null || s.getDateFrom().getMonthValue() == month)
            .filter(s -> format == null || s.getFormat() == format)
            .toList();
    }

    /**
     * Recomputed statement lines, for the transactions export.
     */
    public StatementTotals lines(UUID statementId) {
        FinancialStatement statement = get(statementId);
        return calculator.calculate(statement.getUserId(), statement.getCurrency(),
            statement.getDateFrom(), statement.getDateTo());
    }

    /**
     * Links the stored document, moves the statement to READY and announces it.
     * A statement that is already READY is returned unchanged.
     */
    @Transactional
    public FinancialStatement markReady(UUID statementId, String documentUrl, StatementTotals totals) {
        FinancialStatementEntity entity = repository.findByIdForUpdate(statementId)
            .orElseThrow(() -> ResourceNotFoundException.of("Statement", statementId));
        if (entity.getStatus() == StatementStatus.READY) {
            return entity.toDomain();
        }

        Instant now = clock.instant();
        FinancialStatement ready = entity.toDomain().ready(documentUrl, totals, now);
        entity.updateFromDomain(ready);
        repository.saveAndFlush(entity);

        outboxService.saveEvent(new StatementGeneratedEvent(
            UUID.randomUUID(),
            ready.getId(),
            ready.getUserId(),
            ready.getStatementNumber(),
            ready.getDateFrom(),
            ready.getDateTo(),
            ready.getFormat().name(),
            ready.getNetInvestment(),
            ready.getCurrency().name(),
            documentUrl,
            now
        ));
        activityLogService.record(ready.getUserId(), ActivityType.STATEMENT_GENERATED, "FinancialStatement",
            ready.getId(), "Statement " + ready.getStatementNumber() + " generated");

        log.info("Statement {} ready at {}", ready.getStatementNumber(), documentUrl);
        return ready;
    }

    /**
     * Sends a READY statement to {@code to} and any additional addresses.
     *
     * Delivery is explicit, so member preferences do not apply. Addresses whose
     * send succeeded are appended to the statement's recipient list.
     *
     * @return the updated statement and the outcome per address
     * @throws IllegalStateException if the statement is not READY
     */
    public StatementEmailOutcome email(UUID statementId, String to, List<String> additionalEmails) {
        FinancialStatement statement = get(statementId);
        statement.requireReady();

        Set<String> recipients = new LinkedHashSet<>();
        recipients.add(to.trim());
        if (additionalEmails != null) {
            additionalEmails.stream().map(String::trim).filter(s -> !s.isEmpty()).forEach(recipients::add);
        }

        String userName = memberDirectory.findMember(statement.getUserId())
            .map(MemberProfile::getFullName)
            .orElse("Member");
        String net = moneyFormatter.format(statement.getNetInvestment(), statement.getCurrency());

        Map<String, DispatchResult> results = new LinkedHashMap<>();
        List<String> delivered = new ArrayList<>();
        for (String recipient : recipients) {
            DispatchResult result = dispatcher.dispatch(notificationEventHandler.statementMessage(
                statement.getUserId(), recipient, userName, statement.getStatementNumber(),
                statement.getDateFrom(), statement.getDateTo(), net, statement.getDocumentUrl(), true));
            results.put(recipient, result);
            if (result.getStatus() == DispatchResult.Status.SENT) {
                delivered.add(recipient);
            }
        }

        if (delivered.isEmpty()) {
            log.warn("Statement {} could not be emailed to any of {}", statement.getStatementNumber(), recipients);
            return new StatementEmailOutcome(statement, results);
        }

        FinancialStatement updated = transactionTemplate.execute(status -> {
            FinancialStatementEntity entity = repository.findByIdForUpdate(statementId)
                .orElseThrow(() -> ResourceNotFoundException.of("Statement", statementId));
            FinancialStatement emailed = entity.toDomain().emailed(delivered, clock.instant());
            entity.updateFromDomain(emailed);
            repository.saveAndFlush(entity);
            activityLogService.record(emailed.getUserId(), ActivityType.STATEMENT_EMAILED, "FinancialStatement",
                emailed.getId(), "Statement " + emailed.getStatementNumber() + " emailed to "
                    + String.join(", ", delivered));
            return emailed;
        });

        log.info("Statement {} emailed to {}", statement.getStatementNumber(), delivered);
        return new StatementEmailOutcome(updated, results);
    }
}
