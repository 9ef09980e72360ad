package com.example.SmartDairy.repository;

import com.example.SmartDairy.model.FarmDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FarmDocumentRepository extends JpaRepository<FarmDocument, String> {

    List<FarmDocument> findAllByOrderByUploadedAtDesc();
}
