package com.nevis.notebook.worker;

public record RecoveryReport(int resumed, int failed) {}
