package com.pinclick.copilot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "aws.region=ap-south-1"
})
class SalesCopilotApplicationTests {

    @Test
    void contextLoads() {
        // Wiring check only; the durable session store is switched off in test properties.
    }
}
