package com.codeheadsystems.credvault.server.store;

import com.codeheadsystems.credvault.crypto.EncryptedPayload;
import com.codeheadsystems.credvault.server.exception.StorageException;
import com.codeheadsystems.credvault.server.model.AuditEvent;
import com.codeheadsystems.credvault.server.model.AuditEventType;
import com.codeheadsystems.credvault.server.model.CredentialRecord;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.codeheadsystems.credvault.server.model.ValidationStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link CredentialStore} over a relational database through Spring's {@link JdbcTemplate}.
 * <p>
 * Every operation is a single parameterized statement. The tables are created by
 * {@link CredentialSchemaMigrator}. Audit metadata is stored as a JSON string.
 */
public class JdbcCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcCredentialStore.class);
  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
  };

  private static final String SELECT_RECORD =
      "SELECT owner_id, ciphertext, iv, salt, registered_at, last_used_at, last_validated_at,"
          + " validation_status, remote_user_id, remote_org_id, remote_email"
          + " FROM credential_records WHERE owner_id = ?";
  private static final String INSERT_RECORD =
      "INSERT INTO credential_records (owner_id, ciphertext, iv, salt, registered_at,"
          + " last_used_at, last_validated_at, validation_status, remote_user_id, remote_org_id,"
          + " remote_email) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  private static final String UPDATE_CIPHERTEXT =
      "UPDATE credential_records SET ciphertext = ?, iv = ?, salt = ?, validation_status = ?,"
          + " last_used_at = ? WHERE owner_id = ?";
  private static final String UPDATE_VALIDATION =
      "UPDATE credential_records SET validation_status = ?, last_validated_at = ?"
          + " WHERE owner_id = ?";
  private static final String UPDATE_VALIDATION_WITH_CLAIMS =
      "UPDATE credential_records SET validation_status = ?, last_validated_at = ?,"
          + " remote_user_id = ?, remote_org_id = ?, remote_email = ? WHERE owner_id = ?";
  private static final String TOUCH_LAST_USED =
      "UPDATE credential_records SET last_used_at = ? WHERE owner_id = ?";
  private static final String DELETE_RECORD =
      "DELETE FROM credential_records WHERE owner_id = ?";
  private static final String COUNT_RECORDS =
      "SELECT COUNT(*) FROM credential_records";
  private static final String INSERT_AUDIT =
      "INSERT INTO credential_audit_events (owner_id, event_type, occurred_at, metadata)"
          + " VALUES (?, ?, ?, ?)";
  private static final String SELECT_AUDIT =
      "SELECT owner_id, event_type, occurred_at, metadata FROM credential_audit_events"
          + " WHERE owner_id = ? ORDER BY occurred_at, id";

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public JdbcCredentialStore(DataSource dataSource) {
    this(new JdbcTemplate(dataSource), new ObjectMapper(), Clock.systemUTC());
  }

  public JdbcCredentialStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public Optional<CredentialRecord> getRecord(String identity) {
    try {
      List<CredentialRecord> rows = jdbcTemplate.query(SELECT_RECORD, recordMapper(), identity);
      return rows.stream().findFirst();
    } catch (DataAccessException e) {
      throw new StorageException("Failed to load credential record", e);
    }
  }

  @Override
  public void insertRecord(CredentialRecord record) {
    RemoteIdentityClaims claims = record.remoteIdentityClaims();
    try {
      jdbcTemplate.update(INSERT_RECORD,
          record.identity(),
          record.ciphertext(),
          record.iv(),
          record.salt(),
          record.registeredAt().toEpochMilli(),
          record.lastUsedAt().toEpochMilli(),
          record.lastValidatedAt() == null ? null : record.lastValidatedAt().toEpochMilli(),
          record.validationStatus().wireValue(),
          claims == null ? null : claims.userId(),
          claims == null ? null : claims.orgId(),
          claims == null ? null : claims.email());
      log.debug("Inserted credential record for {}", record.identity());
    } catch (DuplicateKeyException e) {
      throw new StorageException("Credential record already exists for identity " + record.identity(), e);
    } catch (DataAccessException e) {
      throw new StorageException("Failed to insert credential record", e);
    }
  }

  @Override
  public void updateCiphertext(String identity, EncryptedPayload payload) {
    int updated;
    try {
      updated = jdbcTemplate.update(UPDATE_CIPHERTEXT,
          payload.ciphertext(),
          payload.iv(),
          payload.salt(),
          ValidationStatus.PENDING.wireValue(),
          clock.millis(),
          identity);
    } catch (DataAccessException e) {
      throw new StorageException("Failed to update credential", e);
    }
    if (updated == 0) {
      throw new StorageException("No credential record for identity " + identity);
    }
  }

  @Override
  public void updateValidationStatus(String identity, ValidationStatus status,
                                     RemoteIdentityClaims claims) {
    try {
      if (claims == null) {
        jdbcTemplate.update(UPDATE_VALIDATION, status.wireValue(), clock.millis(), identity);
      } else {
        jdbcTemplate.update(UPDATE_VALIDATION_WITH_CLAIMS,
            status.wireValue(),
            clock.millis(),
            claims.userId(),
            claims.orgId(),
            claims.email(),
            identity);
      }
    } catch (DataAccessException e) {
      throw new StorageException("Failed to update validation status", e);
    }
  }

  @Override
  public void touchLastUsed(String identity) {
    try {
      jdbcTemplate.update(TOUCH_LAST_USED, clock.millis(), identity);
    } catch (DataAccessException e) {
      log.warn("Failed to update last-used time for {}", identity, e);
    }
  }

  @Override
  public void deleteRecord(String identity) {
    try {
      int deleted = jdbcTemplate.update(DELETE_RECORD, identity);
      log.debug("Deleted {} credential record(s) for {}", deleted, identity);
    } catch (DataAccessException e) {
      throw new StorageException("Failed to delete credential record", e);
    }
  }

  @Override
  public void appendAuditEvent(AuditEvent event) {
    try {
      String metadata = event.metadata().isEmpty()
          ? null
          : objectMapper.writeValueAsString(event.metadata());
      jdbcTemplate.update(INSERT_AUDIT,
          event.identity(),
          event.eventType().wireValue(),
          event.timestamp().toEpochMilli(),
          metadata);
    } catch (JsonProcessingException | DataAccessException e) {
      log.error("Failed to write {} audit event for {}", event.eventType().wireValue(),
          event.identity(), e);
    }
  }

  @Override
  public long countRecords() {
    try {
      Long count = jdbcTemplate.queryForObject(COUNT_RECORDS, Long.class);
      return count == null ? 0L : count;
    } catch (DataAccessException e) {
      log.warn("Failed to count credential records", e);
      return 0L;
    }
  }

  @Override
  public List<AuditEvent> auditEvents(String identity) {
    try {
      return jdbcTemplate.query(SELECT_AUDIT, auditMapper(), identity);
    } catch (DataAccessException e) {
      throw new StorageException("Failed to load audit events", e);
    }
  }

  private RowMapper<CredentialRecord> recordMapper() {
    return (rs, rowNum) -> {
      String userId = rs.getString("remote_user_id");
      String orgId = rs.getString("remote_org_id");
      String email = rs.getString("remote_email");
      RemoteIdentityClaims claims = userId == null && orgId == null && email == null
          ? null
          : new RemoteIdentityClaims(userId, orgId, email);
      return new CredentialRecord(
          rs.getString("owner_id"),
          rs.getString("ciphertext"),
          rs.getString("iv"),
          rs.getString("salt"),
          Instant.ofEpochMilli(rs.getLong("registered_at")),
          Instant.ofEpochMilli(rs.getLong("last_used_at")),
          nullableInstant(rs, "last_validated_at"),
          ValidationStatus.fromWireValue(rs.getString("validation_status")),
          claims);
    };
  }

  private RowMapper<AuditEvent> auditMapper() {
    return (rs, rowNum) -> new AuditEvent(
        rs.getString("owner_id"),
        AuditEventType.fromWireValue(rs.getString("event_type")),
        Instant.ofEpochMilli(rs.getLong("occurred_at")),
        readMetadata(rs.getString("metadata")));
  }

  private Map<String, Object> readMetadata(String json) {
    if (json == null) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable audit metadata, returning empty map", e);
      return Map.of();
    }
  }

  private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : Instant.ofEpochMilli(value);
  }
}
