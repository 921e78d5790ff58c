package com.openstay.stay.listing.domain.repository;

import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.model.RoomType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.OptimisticLockingFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Repository test on H2 for the listing row: room collection persistence and the version check
 * that backs every inventory rewrite.
 */
@DataJpaTest
class ListingRepositoryTest {

    @Autowired
    private ListingRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private Listing persistListing() {
        Listing listing = Listing.builder()
                .title("Sunrise PG")
                .ownerEmail("owner@example.com")
                .rooms(List.of(
                        new RoomType("Single", 2, 2, 500000, 100000, false),
                        new RoomType("Double", 1, 1, 700000, 150000, true)))
                .build();
        Listing saved = repository.saveAndFlush(listing);
        entityManager.clear();
        return saved;
    }

    @Test
    @DisplayName("room collection round-trips through the JSON column in order")
    void rooms_persistInOrder() {
        Long id = persistListing().getId();

        Listing reloaded = repository.findByIdForUpdate(id).orElseThrow();

        assertThat(reloaded.getRooms()).extracting(RoomType::type).containsExactly("Single", "Double");
        assertThat(reloaded.getRooms().get(1).airConditioned()).isTrue();
        assertThat(reloaded.getVersion()).isNotNull();
    }

    @Test
    @DisplayName("rewriting the collection bumps the version")
    void replaceRoom_bumpsVersion() {
        Listing listing = persistListing();
        Long before = listing.getVersion();

        Listing managed = repository.findById(listing.getId()).orElseThrow();
        managed.replaceRoom(new RoomType("Single", 2, 1, 500000, 100000, false));
        repository.saveAndFlush(managed);
        entityManager.clear();

        Listing reloaded = repository.findById(listing.getId()).orElseThrow();
        assertThat(reloaded.getVersion()).isGreaterThan(before);
        assertThat(reloaded.findRoom("Single")).map(RoomType::available).contains(1);
    }

    @Test
    @DisplayName("a write based on a stale version is refused")
    void staleWrite_isRefused() {
        Listing stale = persistListing();

        Listing current = repository.findById(stale.getId()).orElseThrow();
        current.replaceRoom(new RoomType("Single", 2, 1, 500000, 100000, false));
        repository.saveAndFlush(current);
        entityManager.clear();

        stale.replaceRoom(new RoomType("Single", 2, 1, 500000, 100000, false));
        assertThatThrownBy(() -> repository.saveAndFlush(stale))
                .isInstanceOf(OptimisticLockingFailureException.class);
    }
}
