package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.config.PipelineConfig;
import com.example.fundraisingdashboard.interpreter.KeywordCommandInterpreter;
import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.persistence.ChangeHistoryPersistenceService;
import com.example.fundraisingdashboard.service.handler.ContributionTableHandler;
import com.example.fundraisingdashboard.service.handler.FunderTableHandler;
import com.example.fundraisingdashboard.service.handler.ProspectTableHandler;
import com.example.fundraisingdashboard.service.handler.SchoolTableHandler;
import com.example.fundraisingdashboard.service.handler.TableHandler;
import com.example.fundraisingdashboard.service.handler.TargetTableHandler;
import com.example.fundraisingdashboard.service.handler.UserTableHandler;
import com.example.fundraisingdashboard.store.InMemoryTabularStore;
import com.example.fundraisingdashboard.store.TableRows;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The whole pipeline wired over an in-memory store, with the database mirror mocked out.
 * The store is a spy so single writes can be made to fail.
 */
class PipelineFixture {

    final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
    final PipelineConfig config = new PipelineConfig();
    final InMemoryTabularStore store = Mockito.spy(new InMemoryTabularStore());
    final ChangeHistoryPersistenceService persistence = Mockito.mock(ChangeHistoryPersistenceService.class);
    final CacheInvalidationNotifier cacheNotifier = Mockito.mock(CacheInvalidationNotifier.class);
    final PipelineEventLog eventLog;
    final RiskClassifier classifier = new RiskClassifier();
    final ConfirmationGate gate;
    final ChangeLedger ledger;
    final SnapshotManager snapshots;
    final OperationExecutor executor;
    final RevertEngine revertEngine;
    final DataOperationsService service;

    PipelineFixture() {
        this(new PipelineConfig());
    }

    PipelineFixture(PipelineConfig pipelineConfig) {
        config.setMaxChanges(pipelineConfig.getMaxChanges());
        config.setMaxSnapshots(pipelineConfig.getMaxSnapshots());
        config.setCriticalRecordThreshold(pipelineConfig.getCriticalRecordThreshold());
        config.setConfirmationTtl(pipelineConfig.getConfirmationTtl());

        eventLog = new PipelineEventLog(config, clock);
        gate = new ConfirmationGate(config, eventLog, clock);
        ledger = new ChangeLedger(config, persistence);
        snapshots = new SnapshotManager(store, config, persistence, eventLog, new ObjectMapper(), clock);

        List<TableHandler> handlers = List.of(
            new ContributionTableHandler(store, clock),
            new ProspectTableHandler(store, clock),
            new TargetTableHandler(store, clock),
            new SchoolTableHandler(store, clock),
            new UserTableHandler(store, clock),
            new FunderTableHandler(store, clock));
        executor = new OperationExecutor(handlers, store, classifier, snapshots, ledger, cacheNotifier, eventLog, clock);
        revertEngine = new RevertEngine(ledger, snapshots, executor, eventLog, store);
        service = new DataOperationsService(new KeywordCommandInterpreter(clock), classifier, gate, executor,
            ledger, snapshots, revertEngine, eventLog);
    }

    void seedProspects() {
        store.seed(TableName.PROSPECTS, List.of(
            List.of("P008", "KA", "Tata Trusts", "Proposal", "250000", "0.6", "Follow up", "2024-07-01", "asha"),
            List.of("P009", "TN", "Infosys Foundation", "Lead", "100000", "0.3", "Intro call", "2024-06-15", "ravi",
                "CSR education grant", "", "edu, csr", "Meena", "meena@example.org", "9876543210", "2024-05-20",
                "warm intro via board"),
            List.of("P010", "KL", "Wipro Cares", "Negotiation", "400000", "0.8")));
    }

    List<Map<String, String>> live(TableName table) {
        return TableRows.liveRecords(table, store.getRows(table));
    }

    Map<String, String> find(TableName table, String id) {
        for (Map<String, String> record : live(table)) {
            if (id.equals(record.get("id"))) {
                return record;
            }
        }
        return null;
    }
}
