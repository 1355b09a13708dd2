package com.example.canonical.ingestion.service;

@FunctionalInterface
public interface ProgressListener {

    void onProgress(String file, long rowsRead, long accepted, long quarantined);
}
