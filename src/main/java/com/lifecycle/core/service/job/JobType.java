package com.lifecycle.core.service.job;

public enum JobType {
    ARCHIVE,
    CLEANUP
}
