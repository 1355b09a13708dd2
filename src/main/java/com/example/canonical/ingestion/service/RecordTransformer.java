package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.FileLoadResult;
import com.example.canonical.ingestion.support.OutputLayout;
import java.util.Map;

/**
 * Hook run in the transformation stage over the loaded, non-failed files. Implementations
 * may only write below the output root.
 */
public interface RecordTransformer {

    default String name() {
        return getClass().getSimpleName();
    }

    void transform(Map<String, FileLoadResult> loaded, OutputLayout layout) throws Exception;
}
