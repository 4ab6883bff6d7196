package com.perptrader.backend.service.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perptrader.backend.exception.ExchangeException;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signs Hyperliquid L1 actions. The action is msgpack-encoded, hashed together with the nonce,
 * wrapped in a phantom "Agent" struct and signed as EIP-712 typed data.
 */
public class HyperliquidSigner {

    private static final byte[] DOMAIN_TYPE_HASH = keccak(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)");
    private static final byte[] AGENT_TYPE_HASH = keccak("Agent(string source,bytes32 connectionId)");
    private static final long CHAIN_ID = 1337L;
    private static final byte[] DOMAIN_SEPARATOR = domainSeparator();

    private final ObjectMapper msgpackMapper = new ObjectMapper(new MessagePackFactory());
    private final ECKeyPair keyPair;
    private final String address;
    private final boolean mainnet;

    public HyperliquidSigner(String privateKey, boolean mainnet) {
        Credentials credentials = Credentials.create(Numeric.cleanHexPrefix(privateKey));
        this.keyPair = credentials.getEcKeyPair();
        this.address = credentials.getAddress();
        this.mainnet = mainnet;
    }

    /** Lower-case 0x wallet address derived from the private key. */
    public String getAddress() {
        return address;
    }

    /**
     * Signature object in the {r, s, v} form the exchange endpoint expects.
     * The action map must preserve field order since it is hashed as encoded.
     */
    public Map<String, Object> signAction(Map<String, Object> action, long nonce) {
        byte[] connectionId = actionHash(action, nonce);
        byte[] digest = typedDataDigest(mainnet ? "a" : "b", connectionId);
        Sign.SignatureData signature = Sign.signMessage(digest, keyPair, false);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("r", Numeric.toHexString(signature.getR()));
        result.put("s", Numeric.toHexString(signature.getS()));
        result.put("v", Numeric.toBigInt(signature.getV()).intValue());
        return result;
    }

    byte[] actionHash(Map<String, Object> action, long nonce) {
        byte[] packed;
        try {
            packed = msgpackMapper.writeValueAsBytes(action);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(HyperliquidTrader.NAME, "Could not encode action: " + e.getMessage(), e);
        }
        ByteArrayOutputStream data = new ByteArrayOutputStream();
        data.writeBytes(packed);
        data.writeBytes(ByteBuffer.allocate(Long.BYTES).putLong(nonce).array());
        // no vault address
        data.write(0);
        return Hash.sha3(data.toByteArray());
    }

    static byte[] typedDataDigest(String source, byte[] connectionId) {
        ByteArrayOutputStream struct = new ByteArrayOutputStream();
        struct.writeBytes(AGENT_TYPE_HASH);
        struct.writeBytes(keccak(source));
        struct.writeBytes(connectionId);
        byte[] structHash = Hash.sha3(struct.toByteArray());

        ByteArrayOutputStream message = new ByteArrayOutputStream();
        message.write(0x19);
        message.write(0x01);
        message.writeBytes(DOMAIN_SEPARATOR);
        message.writeBytes(structHash);
        return Hash.sha3(message.toByteArray());
    }

    private static byte[] domainSeparator() {
        ByteArrayOutputStream domain = new ByteArrayOutputStream();
        domain.writeBytes(DOMAIN_TYPE_HASH);
        domain.writeBytes(keccak("Exchange"));
        domain.writeBytes(keccak("1"));
        domain.writeBytes(Numeric.toBytesPadded(BigInteger.valueOf(CHAIN_ID), 32));
        domain.writeBytes(new byte[32]);
        return Hash.sha3(domain.toByteArray());
    }

    private static byte[] keccak(String text) {
        return Hash.sha3(text.getBytes(StandardCharsets.UTF_8));
    }
}
