package fpt.com.ehraccess.domain.accesslog.repository;

import fpt.com.ehraccess.domain.accesslog.entity.PendingAuditEntry;
import fpt.com.ehraccess.domain.accesslog.entity.PendingAuditStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PendingAuditEntryRepository extends JpaRepository<PendingAuditEntry, UUID> {

    List<PendingAuditEntry> findByStatusOrderByCreatedAtAsc(PendingAuditStatus status, Pageable pageable);

    long countByStatus(PendingAuditStatus status);

    long countByRecordIdAndStatus(Long recordId, PendingAuditStatus status);
}
