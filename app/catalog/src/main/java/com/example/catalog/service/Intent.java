package com.example.catalog.service;

public enum Intent {
  REGISTRATION,
  HELP,
  CATALOG_LINK,
  IMAGE_INTAKE,
  CONFIRM,
  CANCEL,
  FALLBACK,
  IGNORED
}
