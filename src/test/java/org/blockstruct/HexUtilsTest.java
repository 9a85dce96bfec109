package org.blockstruct;

import org.junit.Assert;
import org.junit.Test;

public class HexUtilsTest {

    @Test
    public void parsesHexAndDecimal() {
        Assert.assertEquals(16L, HexUtils.parseOffset("0x10"));
        Assert.assertEquals(16L, HexUtils.parseOffset("0X10"));
        Assert.assertEquals(16L, HexUtils.parseOffset("16"));
        Assert.assertEquals(0xffffffffffffffffL, HexUtils.parseOffset("0xffffffffffffffff"));
    }

    @Test(expected = NumberFormatException.class)
    public void rejectsBarePrefix() {
        HexUtils.parseOffset("0x");
    }

    @Test(expected = NumberFormatException.class)
    public void rejectsGarbage() {
        HexUtils.parseOffset("main");
    }

    @Test
    public void rejectsSigns() {
        for (String token : new String[]{"+16", "-16", "0x+10", "0x-10"}) {
            try {
                HexUtils.parseOffset(token);
                Assert.fail(token);
            } catch (NumberFormatException expected) {
                Assert.assertNotNull(expected.getMessage());
            }
        }
        Assert.assertNull(HexUtils.tryParseOffset("+0x20"));
    }

    @Test
    public void tryParseTolerance() {
        Assert.assertEquals(Long.valueOf(0x20), HexUtils.tryParseOffset("#0x20"));
        Assert.assertEquals(Long.valueOf(0x20), HexUtils.tryParseOffset(" 0x20 "));
        Assert.assertNull(HexUtils.tryParseOffset("eax"));
        Assert.assertNull(HexUtils.tryParseOffset(""));
        Assert.assertNull(HexUtils.tryParseOffset(null));
    }

    @Test
    public void formatsAddresses() {
        Assert.assertEquals("0x0", HexUtils.formatAddress(0));
        Assert.assertEquals("0x1f", HexUtils.formatAddress(31));
    }
}
