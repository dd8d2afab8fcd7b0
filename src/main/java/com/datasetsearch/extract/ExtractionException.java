package com.datasetsearch.extract;

import com.datasetsearch.error.DatasetSearchException;
import com.datasetsearch.error.ErrorCode;

/**
 * 单行的取值与 schema 不兼容，只影响这一行。
 */
public class ExtractionException extends DatasetSearchException {
    private final String path;

    public ExtractionException(String path, String message) {
        super(ErrorCode.EXTRACTION_FAILED, path + ": " + message);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
