package com.my.fitsync.adapter.in.web;

import com.my.fitsync.domain.model.StoredArtifact;

import java.time.Instant;
import java.time.LocalDate;

public record ArtifactResponse(String metric, LocalDate date, Instant storedAt, int size) {

    public static ArtifactResponse from(StoredArtifact artifact) {
        return new ArtifactResponse(artifact.metric(), artifact.date(), artifact.storedAt(), artifact.size());
    }
}
