package org.theridian.repository;

import org.theridian.models.entity.ApiKey;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ApiKeyRepository extends JpaRepository<ApiKey, Long> {

    @EntityGraph(attributePaths = "applicationUser")
    List<ApiKey> findAllByApplicationUser_Email(String email, Sort sort);

    @EntityGraph(attributePaths = "applicationUser")
    List<ApiKey> findAllByApplicationUser_EmailAndNameContainingIgnoreCase(String email, String name, Sort sort);

    @EntityGraph(attributePaths = "applicationUser")
    Optional<ApiKey> findByKeyUidAndApplicationUser_Email(String keyUid, String email);

    @EntityGraph(attributePaths = "applicationUser")
    Optional<ApiKey> findByKey(String key);

    boolean existsByKey(String key);
}
