package gmail.cleanup.app.repository;

import gmail.cleanup.app.entity.CachedMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface CachedMessageRepository extends JpaRepository<CachedMessage, String> {
    List<CachedMessage> findAllByOrderByIdAsc(Pageable pageable);
    List<CachedMessage> findByIdGreaterThanOrderByIdAsc(String id, Pageable pageable);

    @Query("SELECT m.id FROM CachedMessage m WHERE m.id IN :ids")
    List<String> findExistingIds(@Param("ids") Collection<String> ids);

    // Cached ids whose header was fetched at or after the staleness cutoff
    @Query("SELECT m.id FROM CachedMessage m WHERE m.id IN :ids AND m.fetchedAt >= :cutoff")
    List<String> findFreshIds(@Param("ids") Collection<String> ids, @Param("cutoff") Instant cutoff);

    @Query("SELECT MIN(m.receivedAt) FROM CachedMessage m")
    Instant findOldestReceivedAt();
}
