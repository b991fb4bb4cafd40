package com.example.pdfmerge.domain.model;

/**
 * Area an artifact lives in. Uploads hold per-job intermediates, output holds merged documents.
 */
public enum StorageArea {
    UPLOADS,
    OUTPUT
}
