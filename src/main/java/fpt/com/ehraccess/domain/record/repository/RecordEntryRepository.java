package fpt.com.ehraccess.domain.record.repository;

import fpt.com.ehraccess.domain.record.entity.RecordEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecordEntryRepository extends JpaRepository<RecordEntry, Long> {

    List<RecordEntry> findByPatientAddressAndActiveTrueOrderByCreatedAtDescRecordIdDesc(String patientAddress);
}
