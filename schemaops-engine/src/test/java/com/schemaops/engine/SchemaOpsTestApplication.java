package com.schemaops.engine;

import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchemaOpsTestApplication {
}
