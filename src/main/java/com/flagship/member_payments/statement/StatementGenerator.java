package com.flagship.member_payments.statement;

import com.flagship.member_payments.document.DocumentGenerator;
import com.flagship.member_payments.document.DocumentStore;
import com.flagship.member_payments.document.GenerationJob;
import com.flagship.member_payments.document.GenerationResult;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.member.MemberDirectory;
import com.flagship.member_payments.member.MemberProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Produces the document for a GENERATING statement.
 *
 * Totals are recomputed from the ledger at generation time, so payments that
 * completed between the request and the job run are included.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatementGenerator implements DocumentGenerator {

    static final String CONTENT_TYPE = "text/html";

    private final StatementService statementService;
    private final StatementCalculator calculator;
    private final StatementRenderer renderer;
    private final DocumentStore documentStore;
    private final MemberDirectory memberDirectory;
    private final Clock clock;

    @Override
    public JobKind kind() {
        return JobKind.STATEMENT;
    }

    @Override
    public GenerationResult generate(GenerationJob job) {
        FinancialStatement statement = statementService.get(job.getSubjectId());
        if (statement.isReady()) {
            log.info("Statement {} already ready", statement.getStatementNumber());
            return new GenerationResult(statement.getStatementNumber(), statement.getDocumentUrl());
        }

        StatementTotals totals = calculator.calculate(statement.getUserId(), statement.getCurrency(),
            statement.getDateFrom(), statement.getDateTo());
        MemberProfile member = memberDirectory.findMember(statement.getUserId()).orElse(null);

        byte[] document = renderer.render(statement, totals, member, clock.instant());
        String url = documentStore.store(statement.getStatementNumber() + ".html", document, CONTENT_TYPE);
        FinancialStatement ready = statementService.markReady(statement.getId(), url, totals);
        return new GenerationResult(ready.getStatementNumber(), ready.getDocumentUrl());
    }

    @Override
    public void onPermanentFailure(GenerationJob job) {
        log.error("Statement generation for {} failed after {} attempts: {}",
                job.getSubjectId(), job.getAttempts(), job.getLastError());
    }
}
