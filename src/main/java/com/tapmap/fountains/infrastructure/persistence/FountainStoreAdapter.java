package com.tapmap.fountains.infrastructure.persistence;

import com.tapmap.fountains.application.port.out.FountainStore;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.ClusterRow;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.FountainStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JPA-backed implementation of the FountainStore output port.
 * Connection failures, timeouts and transactions that cannot start are reported as
 * {@link FountainStore.StoreUnavailableException}; other data access errors propagate as is.
 */
public class FountainStoreAdapter implements FountainStore {

    private static final Logger logger = LoggerFactory.getLogger(FountainStoreAdapter.class);

    private final FountainJpaRepository repository;

    public FountainStoreAdapter(FountainJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<ClusterRow> aggregateByGeohashPrefix(BoundingBox box, int precision, FountainFilter filter) {
        return guarded("aggregate", () -> repository.aggregateByGeohashPrefix(box, precision, filter));
    }

    @Override
    public List<Fountain> findInBounds(BoundingBox box, FountainFilter filter, int maxResults) {
        return guarded("findInBounds", () -> repository.findInBounds(box, filter, maxResults));
    }

    @Override
    public List<Fountain> findAllInBounds(BoundingBox box, FountainFilter filter) {
        return guarded("findAllInBounds", () -> repository.findAllInBounds(box, filter));
    }

    @Override
    public Optional<Fountain> findById(String id) {
        return guarded("findById", () -> repository.findById(id));
    }

    @Override
    public List<Fountain> searchActiveByName(String term, int maxResults) {
        return guarded("searchByName", () -> repository.findByStatusAndNameContainingIgnoreCaseOrderByNameAsc(
                FountainStatus.active, term, PageRequest.of(0, maxResults)));
    }

    @Override
    public List<Fountain> findActiveByGeohashPrefix(String prefix, int maxResults) {
        return guarded("findByGeohashPrefix", () -> repository.findByStatusAndGeohashStartingWithOrderByNameAsc(
                FountainStatus.active, prefix, PageRequest.of(0, maxResults)));
    }

    @Override
    public List<Fountain> searchActiveByTag(String term, int maxResults) {
        return guarded("searchByTag", () -> repository.searchByStatusAndTag(
                FountainStatus.active, term.toLowerCase(Locale.ROOT), PageRequest.of(0, maxResults)));
    }

    @Override
    public long countActive() {
        return guarded("countActive", () -> repository.countByStatus(FountainStatus.active));
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                 | CannotCreateTransactionException e) {
            logger.debug("Fountain store unavailable during {}", operation, e);
            throw new StoreUnavailableException("Fountain store unavailable during " + operation, e);
        }
    }
}
