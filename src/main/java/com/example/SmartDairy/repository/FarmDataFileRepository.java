package com.example.SmartDairy.repository;

import com.example.SmartDairy.model.FarmDataFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface FarmDataFileRepository extends JpaRepository<FarmDataFile, String> {

    /**
     * Most recently registered file among the given ids.
     */
    Optional<FarmDataFile> findFirstByIdInOrderByUploadedAtDesc(Collection<String> ids);

    List<FarmDataFile> findAllByOrderByUploadedAtDesc();
}
