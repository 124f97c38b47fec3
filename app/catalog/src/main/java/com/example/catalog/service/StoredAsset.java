package com.example.catalog.service;

/** Location of a stored image: the public URL and the storage-internal path used for deletion. */
public record StoredAsset(String publicUrl, String storagePath) {}
