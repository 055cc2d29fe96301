package com.bank.mpin.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.bank.mpin.config.AerospikeConfig;
import com.bank.mpin.exception.StorageUnavailableException;
import com.bank.mpin.model.DeviceBinding;
import com.bank.mpin.model.IdentityRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class AerospikeIdentityRepository implements IdentityRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeIdentityRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeIdentityRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<IdentityRecord> findByPhone(String phone) {
        try {
            Record record = client.get(readPolicy, key(phone));
            if (record == null) {
                return Optional.empty();
            }
            return Optional.of(mapRecord(phone, record));
        } catch (AerospikeException e) {
            throw new StorageUnavailableException("Identity store read failed", e);
        }
    }

    @Override
    public boolean create(IdentityRecord identity) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(policy, key(identity.getPhone()), toBins(identity));
            identity.setGeneration(1);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw new StorageUnavailableException("Identity store write failed", e);
        }
    }

    @Override
    public boolean updateIfUnchanged(IdentityRecord identity) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = identity.getGeneration();
        try {
            client.put(policy, key(identity.getPhone()), toBins(identity));
            identity.setGeneration(identity.getGeneration() + 1);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Generation conflict updating identity, expected generation {}", identity.getGeneration());
                return false;
            }
            throw new StorageUnavailableException("Identity store write failed", e);
        }
    }

    private Key key(String phone) {
        return new Key(namespace, AerospikeConfig.SET_IDENTITIES, phone);
    }

    private Bin[] toBins(IdentityRecord identity) {
        return new Bin[]{
                new Bin("identityId", identity.getIdentityId()),
                new Bin("phone", identity.getPhone()),
                new Bin("name", identity.getName()),
                new Bin("mpinDigest", identity.getMpinDigest()),
                new Bin("mpinSalt", identity.getMpinSalt()),
                new Bin("devices", serializeDevices(identity.getDevices())),
                new Bin("failedAttempts", identity.getFailedAttempts()),
                new Bin("lockedUntil", identity.getLockedUntil()),
                new Bin("createdAt", identity.getCreatedAt()),
                new Bin("lastLoginAt", identity.getLastLoginAt())
        };
    }

    private IdentityRecord mapRecord(String phone, Record record) {
        return IdentityRecord.builder()
                .identityId(record.getString("identityId"))
                .phone(phone)
                .name(record.getString("name"))
                .mpinDigest(record.getString("mpinDigest"))
                .mpinSalt(record.getString("mpinSalt"))
                .devices(deserializeDevices(record.getString("devices")))
                .failedAttempts((int) record.getLong("failedAttempts"))
                .lockedUntil(record.getLong("lockedUntil"))
                .createdAt(record.getLong("createdAt"))
                .lastLoginAt(record.getLong("lastLoginAt"))
                .generation(record.generation)
                .build();
    }

    private String serializeDevices(List<DeviceBinding> devices) {
        try {
            return objectMapper.writeValueAsString(devices);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Device bindings not serializable", e);
        }
    }

    private List<DeviceBinding> deserializeDevices(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<DeviceBinding>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize device bindings: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
