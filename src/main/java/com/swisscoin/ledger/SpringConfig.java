package com.swisscoin.ledger;

import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpringConfig {
}
