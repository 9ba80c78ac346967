package fpt.com.ehraccess.domain.record.service;

import fpt.com.ehraccess.common.constants.Constants;
import fpt.com.ehraccess.common.exception.BadRequestException;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.NotFoundException;
import fpt.com.ehraccess.common.util.TimeUtils;
import fpt.com.ehraccess.domain.record.entity.RecordEntry;
import fpt.com.ehraccess.domain.record.entity.RecordType;
import fpt.com.ehraccess.domain.record.repository.RecordEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Append-only store of record entries and sole allocator of record ids.
 * <p>
 * The write gate ("uploader is authorized for this patient") is evaluated by the access facade
 * inside the patient's lane immediately before {@link #addRecord}; this service only stores.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordLedgerService {

    private final RecordEntryRepository repository;
    private final Clock clock;

    @Transactional
    public RecordEntry addRecord(String patientAddress, String uploaderAddress, String contentHash,
                                 RecordType recordType, String description) {
        if (recordType == null) {
            throw new BadRequestException(ErrorCode.INVALID_TYPE, "recordType");
        }
        String text = description == null ? "" : description.trim();
        if (text.length() > Constants.MAX_DESCRIPTION_LENGTH) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, "description");
        }
        RecordEntry entry = RecordEntry.builder()
                .patientAddress(requireText(patientAddress, "patientAddress", Constants.MAX_ADDRESS_LENGTH))
                .uploaderAddress(requireText(uploaderAddress, "uploaderAddress", Constants.MAX_ADDRESS_LENGTH))
                .contentHash(requireText(contentHash, "contentHash", Constants.MAX_CONTENT_HASH_LENGTH))
                .recordType(recordType)
                .description(text)
                .createdAt(TimeUtils.now(clock))
                .active(true)
                .build();
        RecordEntry saved = repository.saveAndFlush(entry);
        log.info("Ledger stored record {} ({}) for patient {} by {}",
                saved.getRecordId(), saved.getRecordType(), saved.getPatientAddress(), saved.getUploaderAddress());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<RecordEntry> getRecordsForPatient(String patientAddress) {
        if (patientAddress == null || patientAddress.isBlank()) {
            return List.of();
        }
        return List.copyOf(repository.findByPatientAddressAndActiveTrueOrderByCreatedAtDescRecordIdDesc(patientAddress.trim()));
    }

    @Transactional(readOnly = true)
    public RecordEntry getRecord(Long recordId) {
        if (recordId == null) {
            throw new NotFoundException(ErrorCode.NOT_FOUND, "recordId");
        }
        return repository.findById(recordId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.NOT_FOUND, "recordId"));
    }

    @Transactional(readOnly = true)
    public boolean exists(Long recordId) {
        return recordId != null && repository.existsById(recordId);
    }

    /**
     * Takes the record out of patient listings. Idempotent; the first archiver is kept.
     */
    @Transactional
    public RecordEntry archive(Long recordId, String archivedBy) {
        RecordEntry entry = getRecord(recordId);
        if (!entry.isActive()) {
            log.debug("Record {} already archived", recordId);
            return entry;
        }
        entry.archive(archivedBy, TimeUtils.now(clock));
        RecordEntry saved = repository.save(entry);
        log.info("Record {} archived by {}", recordId, archivedBy);
        return saved;
    }

    private String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank() || value.trim().length() > maxLength) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, field);
        }
        return value.trim();
    }
}
