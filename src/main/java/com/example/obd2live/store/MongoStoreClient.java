package com.example.obd2live.store;

import com.example.obd2live.exception.TransientStoreException;
import com.example.obd2live.model.AnalysisKind;
import com.example.obd2live.model.AnalysisRecord;
import com.example.obd2live.model.DataPoint;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SharedSession;
import com.example.obd2live.repo.AnalysisRecordRepo;
import com.example.obd2live.repo.DataPointRepo;
import com.example.obd2live.repo.DiagnosticSessionRepo;
import com.example.obd2live.repo.SharedSessionRepo;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Component
public class MongoStoreClient implements StoreClient {

    private static final Logger logger = LoggerFactory.getLogger(MongoStoreClient.class);

    private final MongoTemplate mongo;
    private final DiagnosticSessionRepo sessionRepo;
    private final DataPointRepo dataPointRepo;
    private final AnalysisRecordRepo analysisRepo;
    private final SharedSessionRepo sharedRepo;

    public MongoStoreClient(MongoTemplate mongo,
                            DiagnosticSessionRepo sessionRepo,
                            DataPointRepo dataPointRepo,
                            AnalysisRecordRepo analysisRepo,
                            SharedSessionRepo sharedRepo) {
        this.mongo = mongo;
        this.sessionRepo = sessionRepo;
        this.dataPointRepo = dataPointRepo;
        this.analysisRepo = analysisRepo;
        this.sharedRepo = sharedRepo;
    }

    @Override
    public DiagnosticSession saveSession(DiagnosticSession session) {
        return call("save session " + session.getId(), () -> sessionRepo.save(session));
    }

    @Override
    public Optional<DiagnosticSession> getSession(String sessionId) {
        return call("load session " + sessionId, () -> sessionRepo.findById(sessionId));
    }

    @Override
    public void updateSession(String sessionId, Map<String, Object> fields) {
        Update update = new Update();
        fields.forEach(update::set);
        update.set("updatedAt", Instant.now());
        run("update session " + sessionId,
                () -> mongo.updateFirst(byId(sessionId), update, DiagnosticSession.class));
    }

    @Override
    public void incrementSessionCounter(String sessionId, String field, long delta) {
        Update update = new Update().inc(field, delta).set("updatedAt", Instant.now());
        run("increment " + field + " on session " + sessionId,
                () -> mongo.updateFirst(byId(sessionId), update, DiagnosticSession.class));
    }

    @Override
    public void deleteSessionCascade(String sessionId) {
        run("delete session " + sessionId, () -> {
            long points = dataPointRepo.deleteBySessionId(sessionId);
            long analyses = analysisRepo.deleteBySessionId(sessionId);
            long shares = sharedRepo.deleteBySessionId(sessionId);
            sessionRepo.deleteById(sessionId);
            logger.info("Deleted session {} with {} data points, {} analyses, {} shares",
                    sessionId, points, analyses, shares);
        });
    }

    @Override
    public void insertBatch(String sessionId, List<DataPoint> points) {
        run("insert " + points.size() + " data points for session " + sessionId,
                () -> mongo.insert(points, DataPoint.class));
    }

    @Override
    public long countDataPoints(String sessionId) {
        return call("count data points for session " + sessionId,
                () -> dataPointRepo.countBySessionId(sessionId));
    }

    @Override
    public List<DataPoint> findDataPoints(String sessionId, Instant since, int limit) {
        Criteria criteria = Criteria.where("sessionId").is(sessionId);
        if (since != null) {
            criteria = criteria.and("timestamp").gt(since);
        }
        Query q = new Query(criteria).with(Sort.by(Sort.Direction.ASC, "timestamp"));
        if (limit > 0) q.limit(limit);
        return call("find data points for session " + sessionId, () -> mongo.find(q, DataPoint.class));
    }

    @Override
    public AnalysisRecord saveAnalysis(AnalysisRecord record) {
        return call("save analysis " + record.getAnalysisId(), () -> analysisRepo.save(record));
    }

    @Override
    public List<AnalysisRecord> findAnalyses(String sessionId, AnalysisKind kind) {
        return call("find analyses for session " + sessionId,
                () -> analysisRepo.findBySessionIdAndKindOrderByTimestampAsc(sessionId, kind));
    }

    @Override
    public SharedSession saveSharedSession(SharedSession shared) {
        return call("save shared session " + shared.getShareCode(), () -> sharedRepo.save(shared));
    }

    @Override
    public Optional<SharedSession> findSharedSession(String shareCode) {
        return call("load shared session " + shareCode, () -> sharedRepo.findByShareCode(shareCode));
    }

    @Override
    public List<SharedSession> findActiveSharedSessions() {
        return call("list active shared sessions", sharedRepo::findByActiveTrue);
    }

    @Override
    public void touchSharedClient(String shareCode, String clientId, Instant seenAt) {
        Update update = new Update().set("connectedClients." + clientId, seenAt);
        run("touch client " + clientId + " on share " + shareCode,
                () -> mongo.updateFirst(byShareCode(shareCode), update, SharedSession.class));
    }

    @Override
    public void removeSharedClient(String shareCode, String clientId) {
        Update update = new Update().unset("connectedClients." + clientId);
        run("remove client " + clientId + " from share " + shareCode,
                () -> mongo.updateFirst(byShareCode(shareCode), update, SharedSession.class));
    }

    @Override
    public long deactivateSharedSessions(String sessionId) {
        Query q = new Query(Criteria.where("sessionId").is(sessionId).and("active").is(true));
        return call("deactivate shares of session " + sessionId,
                () -> mongo.updateMulti(q, new Update().set("active", false), SharedSession.class)
                        .getModifiedCount());
    }

    @Override
    public void ping() {
        run("ping", () -> mongo.executeCommand(new Document("ping", 1)));
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static Query byShareCode(String shareCode) {
        return new Query(Criteria.where("shareCode").is(shareCode));
    }

    private <T> T call(String action, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to " + action, e);
        }
    }

    private void run(String action, Runnable op) {
        try {
            op.run();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to " + action, e);
        }
    }
}
