package com.pagecraft.repository;

import com.pagecraft.domain.PageDesign;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PageDesignRepository extends JpaRepository<PageDesign, UUID> {

    List<PageDesign> findByOwnerId(String ownerId);
}
