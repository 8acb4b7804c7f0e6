package com.esign.search.text;

public enum TextProvider {
    LUCENE,
    BASIC
}
