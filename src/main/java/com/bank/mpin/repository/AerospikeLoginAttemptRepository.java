package com.bank.mpin.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.QueryPolicy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.aerospike.client.query.Filter;
import com.aerospike.client.query.IndexType;
import com.aerospike.client.query.RecordSet;
import com.aerospike.client.query.Statement;
import com.aerospike.client.task.IndexTask;
import com.bank.mpin.config.AerospikeConfig;
import com.bank.mpin.config.LedgerConfig;
import com.bank.mpin.exception.StorageUnavailableException;
import com.bank.mpin.model.AttemptReason;
import com.bank.mpin.model.LoginAttempt;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Login attempts, one record per attempt. Each record carries a TTL equal to the
 * retention window so the server expires old rows on its own; {@link #purgeOlderThan}
 * sweeps anything written before the TTL was in place.
 */
@Repository
public class AerospikeLoginAttemptRepository implements LoginAttemptRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeLoginAttemptRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final QueryPolicy queryPolicy;
    private final LedgerConfig ledgerConfig;

    public AerospikeLoginAttemptRepository(AerospikeClient client,
                                           @Qualifier("aerospikeNamespace") String namespace,
                                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                           @Qualifier("defaultQueryPolicy") QueryPolicy queryPolicy,
                                           LedgerConfig ledgerConfig) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.queryPolicy = queryPolicy;
        this.ledgerConfig = ledgerConfig;
    }

    @PostConstruct
    public void ensureIndex() {
        try {
            IndexTask task = client.createIndex(null, namespace, AerospikeConfig.SET_LOGIN_ATTEMPTS,
                    AerospikeConfig.INDEX_ATTEMPT_PHONE, "phone", IndexType.STRING);
            if (task != null) {
                task.waitTillComplete();
            }
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.INDEX_ALREADY_EXISTS) {
                log.warn("Could not create login attempt phone index: {}", e.getMessage());
            }
        }
    }

    @Override
    public void save(LoginAttempt attempt) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.expiration = ledgerConfig.getRetentionSeconds();

        Key key = new Key(namespace, AerospikeConfig.SET_LOGIN_ATTEMPTS, attempt.getAttemptId());
        try {
            client.put(policy, key,
                    new Bin("attemptId", attempt.getAttemptId()),
                    new Bin("phone", attempt.getPhone()),
                    new Bin("ip", attempt.getIp()),
                    new Bin("fingerprint", attempt.getFingerprint()),
                    new Bin("userAgent", attempt.getUserAgent()),
                    new Bin("success", attempt.isSuccess()),
                    new Bin("reason", attempt.getReason().getCode()),
                    new Bin("riskScore", attempt.getRiskScore()),
                    new Bin("timestamp", attempt.getTimestamp()));
        } catch (AerospikeException e) {
            throw new StorageUnavailableException("Login attempt write failed", e);
        }
    }

    @Override
    public List<LoginAttempt> findRecentByPhone(String phone, long since, int limit) {
        Statement statement = new Statement();
        statement.setNamespace(namespace);
        statement.setSetName(AerospikeConfig.SET_LOGIN_ATTEMPTS);
        statement.setFilter(Filter.equal("phone", phone));

        QueryPolicy policy = new QueryPolicy(queryPolicy);
        policy.filterExp = Exp.build(Exp.ge(Exp.intBin("timestamp"), Exp.val(since)));

        List<LoginAttempt> results = new ArrayList<>();
        try (RecordSet recordSet = client.query(policy, statement)) {
            while (recordSet.next()) {
                results.add(mapRecord(recordSet.getRecord()));
            }
        } catch (AerospikeException e) {
            throw new StorageUnavailableException("Login attempt query failed", e);
        }

        results.sort(Comparator.comparingLong(LoginAttempt::getTimestamp).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    @Override
    public int purgeOlderThan(long cutoff) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = false;
        scanPolicy.filterExp = Exp.build(Exp.lt(Exp.intBin("timestamp"), Exp.val(cutoff)));

        AtomicInteger purged = new AtomicInteger();
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_LOGIN_ATTEMPTS,
                    (key, record) -> {
                        if (client.delete(writePolicy, key)) {
                            purged.incrementAndGet();
                        }
                    });
        } catch (AerospikeException e) {
            throw new StorageUnavailableException("Login attempt purge failed", e);
        }
        return purged.get();
    }

    private LoginAttempt mapRecord(Record record) {
        return LoginAttempt.builder()
                .attemptId(record.getString("attemptId"))
                .phone(record.getString("phone"))
                .ip(record.getString("ip"))
                .fingerprint(record.getString("fingerprint"))
                .userAgent(record.getString("userAgent"))
                .success(record.getBoolean("success"))
                .reason(AttemptReason.fromCode(record.getString("reason")))
                .riskScore((int) record.getLong("riskScore"))
                .timestamp(record.getLong("timestamp"))
                .build();
    }
}
