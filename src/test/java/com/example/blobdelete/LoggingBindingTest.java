package com.example.blobdelete;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LoggingBindingTest {

    @Test
    void slf4jLoggerFactory_isLog4j() {
        assertEquals("org.apache.logging.slf4j.Log4jLoggerFactory",
                LoggerFactory.getILoggerFactory().getClass().getName());
    }

    @Test
    void azureSdkLoggerName_resolvesToLog4jLogger() {
        assertEquals("org.apache.logging.slf4j.Log4jLogger",
                LoggerFactory.getLogger("com.azure.core").getClass().getName());
    }
}
