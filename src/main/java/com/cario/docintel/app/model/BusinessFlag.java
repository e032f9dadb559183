package com.cario.docintel.app.model;

/** The business flag a document type's verification gate controls. */
public enum BusinessFlag {
  VERIFIED,
  COMPLETED,
  SIGNED
}
