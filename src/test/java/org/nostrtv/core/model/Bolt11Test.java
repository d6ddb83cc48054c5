package org.nostrtv.core.model;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for BOLT-11 amount parsing.
 */
public class Bolt11Test {

    @Test
    public void testMultipliers() {
        assertEquals(Long.valueOf(250_000_000L), Bolt11.amountMillisats("lnbc2500u1pvjluezpp5qqqsyqcyq5rqwzqf"));
        assertEquals(Long.valueOf(1_000L), Bolt11.amountMillisats("lnbc10n1pjqqqqq"));
        assertEquals(Long.valueOf(100_000_000L), Bolt11.amountMillisats("lnbc1m1pjqqqqq"));
        assertEquals(Long.valueOf(150L), Bolt11.amountMillisats("lnbc1500p1pjqqqqq"));
    }

    @Test
    public void testNetworks() {
        assertEquals(Long.valueOf(2_000_000_000L), Bolt11.amountMillisats("lntb20m1pjqqqqq"));
        assertEquals(Long.valueOf(500_000L), Bolt11.amountMillisats("lnbcrt5u1pjqqqqq"));
    }

    @Test
    public void testPrefixAndCase() {
        assertEquals(Long.valueOf(1_000L), Bolt11.amountMillisats("lightning:LNBC10N1PJQQQQQ"));
    }

    @Test
    public void testOverflowingAmount() {
        assertNull(Bolt11.amountMillisats("lnbc1000000000" + "1pvjluezpp5"));
        assertNull(Bolt11.amountMillisats("lnbc999999999999m1pjqqqqq"));
        assertEquals(Long.valueOf(2_100_000_000_000_000_000L), Bolt11.amountMillisats("lnbc21000000" + "1pjqqqqq"));
    }

    @Test
    public void testNoAmount() {
        assertNull(Bolt11.amountMillisats("lnbc1pjqqqqq"));
        assertNull(Bolt11.amountMillisats("lnbc12x1pjqqqqq"));
        assertNull(Bolt11.amountMillisats("bitcoin"));
        assertNull(Bolt11.amountMillisats(null));
    }
}
