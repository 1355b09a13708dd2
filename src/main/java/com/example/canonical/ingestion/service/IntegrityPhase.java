package com.example.canonical.ingestion.service;

public enum IntegrityPhase {
    PRE,
    POST
}
