package com.nevis.notebook.controller;

final class OwnerHeader {

    static final String NAME = "X-Owner-Id";

    private OwnerHeader() {
    }
}
