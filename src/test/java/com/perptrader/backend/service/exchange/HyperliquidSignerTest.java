package com.perptrader.backend.service.exchange;

import org.junit.jupiter.api.Test;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HyperliquidSignerTest {

    // well-known development key, never funded
    private static final String PRIVATE_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final String ADDRESS = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";

    private static Map<String, Object> leverageAction() {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "updateLeverage");
        action.put("asset", 0);
        action.put("isCross", false);
        action.put("leverage", 5);
        return action;
    }

    @Test
    void getAddress_shouldDeriveWalletFromKey() {
        assertEquals(ADDRESS, new HyperliquidSigner(PRIVATE_KEY, true).getAddress());
        assertEquals(ADDRESS, new HyperliquidSigner(PRIVATE_KEY.substring(2), true).getAddress());
    }

    @Test
    void signAction_shouldBeDeterministicAndRecoverable() throws Exception {
        HyperliquidSigner signer = new HyperliquidSigner(PRIVATE_KEY, true);
        long nonce = 1736935200000L;

        Map<String, Object> first = signer.signAction(leverageAction(), nonce);
        Map<String, Object> second = signer.signAction(leverageAction(), nonce);

        assertEquals(first, second);
        String r = (String) first.get("r");
        String s = (String) first.get("s");
        int v = (Integer) first.get("v");
        assertTrue(r.startsWith("0x"));
        assertTrue(v == 27 || v == 28, "v=" + v);

        byte[] digest = HyperliquidSigner.typedDataDigest("a", signer.actionHash(leverageAction(), nonce));
        Sign.SignatureData signature = new Sign.SignatureData((byte) v,
                Numeric.toBytesPadded(Numeric.toBigInt(r), 32), Numeric.toBytesPadded(Numeric.toBigInt(s), 32));
        BigInteger publicKey = Sign.signedMessageHashToKey(digest, signature);
        assertEquals(ADDRESS, "0x" + Keys.getAddress(publicKey));
    }

    @Test
    void signAction_shouldDependOnNetworkAndNonce() {
        HyperliquidSigner mainnet = new HyperliquidSigner(PRIVATE_KEY, true);
        HyperliquidSigner testnet = new HyperliquidSigner(PRIVATE_KEY, false);

        Map<String, Object> base = mainnet.signAction(leverageAction(), 1L);

        assertNotEquals(base.get("r"), testnet.signAction(leverageAction(), 1L).get("r"));
        assertNotEquals(base.get("r"), mainnet.signAction(leverageAction(), 2L).get("r"));
    }

    @Test
    void actionHash_shouldFollowFieldOrder() {
        HyperliquidSigner signer = new HyperliquidSigner(PRIVATE_KEY, true);
        Map<String, Object> reordered = new LinkedHashMap<>();
        reordered.put("asset", 0);
        reordered.put("type", "updateLeverage");
        reordered.put("isCross", false);
        reordered.put("leverage", 5);

        byte[] hash = signer.actionHash(leverageAction(), 1L);

        assertEquals(32, hash.length);
        assertArrayEquals(hash, signer.actionHash(leverageAction(), 1L));
        assertFalse(Arrays.equals(hash, signer.actionHash(reordered, 1L)));
    }
}
