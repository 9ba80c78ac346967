package fpt.com.ehraccess.domain.accesslog.repository;

import fpt.com.ehraccess.domain.accesslog.entity.AccessLogEntry;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Deliberately narrow: the log can be appended to and read, never updated or deleted.
 */
@org.springframework.stereotype.Repository
public interface AccessLogEntryRepository extends Repository<AccessLogEntry, Long> {

    AccessLogEntry save(AccessLogEntry entry);

    Optional<AccessLogEntry> findTopByRecordIdOrderBySequenceNoDesc(Long recordId);

    List<AccessLogEntry> findByRecordIdOrderByTimestampAscSequenceNoAsc(Long recordId);

    List<AccessLogEntry> findByRecordIdOrderBySequenceNoAsc(Long recordId);
}
