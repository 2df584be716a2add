package com.nosota.wagerbook;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WagerbookApplicationTests extends TestBase {

    @Test
    void contextLoads() {
        assertThat(wagerLedgerEngine).isNotNull();
        assertThat(balanceConsistencyService.verifyAll()).isEmpty();
    }
}
