package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges match candidates and merge records to their JPA rows.
 *
 * Writes join the caller's transaction, so a merge or split commits or rolls back the
 * candidate, the audit record and both event streams together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchCandidatePersistenceService {

    private final MatchCandidateRepository candidateRepository;
    private final MergeRecordRepository mergeRecordRepository;

    @Transactional
    public MatchCandidate save(MatchCandidate candidate) {
        MatchCandidateEntity saved = candidateRepository.save(MatchCandidateEntity.fromDomain(candidate));
        log.debug("Saved match candidate {} ({} <-> {})", saved.getId(), candidate.getEntityAId(),
            candidate.getEntityBId());
        return saved.toDomain();
    }

    /**
     * Writes a status change through the managed row, so the version column catches
     * a concurrent review of the same candidate.
     */
    @Transactional
    public MatchCandidate update(MatchCandidate candidate) {
        MatchCandidateEntity existing = candidateRepository.findById(candidate.getId())
            .orElseThrow(() -> new EntityNotFoundException("match candidate", candidate.getId()));
        existing.updateFromDomain(candidate);
        MatchCandidateEntity saved = candidateRepository.save(existing);
        log.debug("Updated match candidate {} to {}", saved.getId(), candidate.getStatus());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<MatchCandidate> findById(UUID candidateId) {
        return candidateRepository.findById(candidateId).map(MatchCandidateEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public MatchCandidate getById(UUID candidateId) {
        return findById(candidateId)
            .orElseThrow(() -> new EntityNotFoundException("match candidate", candidateId));
    }

    @Transactional(readOnly = true)
    public List<MatchCandidate> list(MatchStatus status) {
        List<MatchCandidateEntity> rows = status != null
            ? candidateRepository.findByStatusOrderBySubmittedAtDesc(status)
            : candidateRepository.findAllByOrderBySubmittedAtDesc();
        return rows.stream().map(MatchCandidateEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<MatchCandidate> findPendingForPair(UUID first, UUID second) {
        return candidateRepository.findPendingForPair(first, second).stream()
            .map(MatchCandidateEntity::toDomain)
            .toList();
    }

    @Transactional
    public MergeRecord saveMergeRecord(MergeRecord record) {
        MergeRecordEntity saved = mergeRecordRepository.save(MergeRecordEntity.fromDomain(record));
        log.debug("Saved merge record {} for candidate {}", saved.getId(), record.getCandidateId());
        return saved.toDomain();
    }

    @Transactional
    public MergeRecord updateMergeRecord(MergeRecord record) {
        MergeRecordEntity existing = mergeRecordRepository.findById(record.getId())
            .orElseThrow(() -> new EntityNotFoundException("merge record", record.getId()));
        existing.updateFromDomain(record);
        return mergeRecordRepository.save(existing).toDomain();
    }

    /**
     * The merge record a split would reverse: the latest one not yet split.
     */
    @Transactional(readOnly = true)
    public Optional<MergeRecord> findActiveMergeRecord(UUID candidateId) {
        return mergeRecordRepository.findFirstByCandidateIdAndSplitAtIsNull(candidateId)
            .map(MergeRecordEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<MergeRecord> findMergeRecords(UUID candidateId) {
        return mergeRecordRepository.findByCandidateIdOrderByMergedAtDesc(candidateId).stream()
            .map(MergeRecordEntity::toDomain)
            .toList();
    }

    /**
     * Nulls every reference to an erased entity. Returns the number of rows touched.
     */
    @Transactional
    public int clearReferences(UUID entityId) {
        int touched = candidateRepository.clearEntityA(entityId)
            + candidateRepository.clearEntityB(entityId)
            + candidateRepository.clearSurvivor(entityId)
            + mergeRecordRepository.clearSurvivor(entityId)
            + mergeRecordRepository.clearAbsorbed(entityId)
            + mergeRecordRepository.clearSplitEntity(entityId);
        log.debug("Cleared {} merge references to {}", touched, entityId);
        return touched;
    }
}
