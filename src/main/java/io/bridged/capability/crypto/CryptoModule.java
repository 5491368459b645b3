package io.bridged.capability.crypto;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityModule;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Operation;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.model.HandleKind;
import io.bridged.util.Jsons;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class CryptoModule implements CapabilityModule {
    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    public String name() {
        return "crypto";
    }

    @Override
    public Map<String, Operation> operations() {
        Map<String, Operation> ops = new LinkedHashMap<>();
        ops.put("new", this::newCipher);
        ops.put("encrypt", this::encrypt);
        ops.put("decrypt", this::decrypt);
        ops.put("cleanup_cipher", this::cleanup);
        return ops;
    }

    private ObjectNode newCipher(Params params, InvocationContext ctx) throws Exception {
        CipherAlgorithm algorithm = CipherAlgorithm.fromString(params.text("cipher", "Blowfish"));
        byte[] raw;
        if (params.has("key")) {
            raw = KeyMaterial.decode(params.requireText("key"));
        } else if (params.has("key_file")) {
            raw = KeyMaterial.fromFile(Path.of(params.requireText("key_file")));
        } else {
            throw BridgeException.validation("either 'key' or 'key_file' is required");
        }
        CipherContext context = new CipherContext(algorithm, raw, secureRandom);
        // Fail at creation time if the provider rejects the key.
        try {
            context.encrypt(new byte[0]);
        } catch (GeneralSecurityException e) {
            context.close();
            throw BridgeException.execution("Cipher initialization failed: " + e.getMessage(), e);
        }
        String id = ctx.pool().create(HandleKind.CIPHER_CONTEXT, context, ctx.exchangeId());
        ObjectNode out = Jsons.object();
        out.put("cipher_id", id);
        out.put("cipher", algorithm.displayName());
        out.put("key_length", context.keyLength());
        return out;
    }

    private ObjectNode encrypt(Params params, InvocationContext ctx) throws Exception {
        String cipherId = params.requireText("cipher_id");
        String encoding = encoding(params);
        String plaintext = params.requireText("plaintext");
        byte[] input = "hex".equals(encoding) ? parseHex(plaintext, "plaintext") : plaintext.getBytes(StandardCharsets.UTF_8);
        return ctx.pool().withHandle(cipherId, HandleKind.CIPHER_CONTEXT, h -> {
            CipherContext context = h.state(CipherContext.class);
            String encrypted = HexFormat.of().formatHex(context.encrypt(input));
            ObjectNode out = Jsons.object();
            out.put("encrypted", encrypted);
            out.put("length", encrypted.length());
            out.put("algorithm", context.algorithm().displayName());
            return out;
        });
    }

    private ObjectNode decrypt(Params params, InvocationContext ctx) throws Exception {
        String cipherId = params.requireText("cipher_id");
        String encoding = encoding(params);
        byte[] input = parseHex(params.firstText("ciphertext", "hex_ciphertext"), "ciphertext");
        return ctx.pool().withHandle(cipherId, HandleKind.CIPHER_CONTEXT, h -> {
            CipherContext context = h.state(CipherContext.class);
            byte[] plain;
            try {
                plain = context.decrypt(input);
            } catch (GeneralSecurityException e) {
                throw BridgeException.execution("Decryption failed: " + e.getMessage(), e);
            }
            String decrypted = "hex".equals(encoding) ? HexFormat.of().formatHex(plain) : utf8OrLatin1(plain);
            ObjectNode out = Jsons.object();
            out.put("decrypted", decrypted);
            out.put("length", plain.length);
            out.put("algorithm", context.algorithm().displayName());
            return out;
        });
    }

    private ObjectNode cleanup(Params params, InvocationContext ctx) {
        String cipherId = params.requireText("cipher_id");
        ctx.pool().removeExpected(cipherId, HandleKind.CIPHER_CONTEXT);
        ObjectNode out = Jsons.object();
        out.put("cipher_id", cipherId);
        out.put("cleaned", true);
        return out;
    }

    private static String encoding(Params params) {
        String raw = params.text("encoding", "utf8").trim().toLowerCase(Locale.ROOT);
        switch (raw) {
            case "utf8":
            case "utf-8":
                return "utf8";
            case "hex":
                return "hex";
            default:
                throw BridgeException.validation("unsupported encoding: " + raw);
        }
    }

    private static byte[] parseHex(String value, String name) {
        String trimmed = value.trim();
        if (trimmed.length() % 2 != 0 || !trimmed.matches("[0-9a-fA-F]*")) {
            throw BridgeException.validation("parameter '" + name + "' is not valid hex");
        }
        return HexFormat.of().parseHex(trimmed);
    }

    private static String utf8OrLatin1(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
