package com.example.hotelconcierge.repository;

import com.example.hotelconcierge.model.entity.HotelDocument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface HotelDocumentRepository extends JpaRepository<HotelDocument, Long> {

    List<HotelDocument> findByActiveTrueOrderByUploadDateDesc();
}
