/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ilayer.rfq.identity;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.util.encoders.Hex;

import java.security.SecureRandom;

/**
 * Per-process secp256k1 identity. A new one is generated at every start and never persisted.
 * <p>
 * The public key is rendered the way an Ethereum wallet reports it: {@code 0x} followed by the
 * 33-byte compressed point in hex. That string is both the solver id carried in responses and the
 * input to {@link Buckets#bucketOf(String)}.
 */
public final class SessionIdentity
{
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters DOMAIN = new ECDomainParameters(
        CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(), CURVE_PARAMS.getH());

    private final ECPrivateKeyParameters privateKey;
    private final String publicKey;
    private final String bucket;

    private SessionIdentity(final ECPrivateKeyParameters privateKey, final ECPublicKeyParameters publicKey)
    {
        this.privateKey = privateKey;
        this.publicKey = "0x" + Hex.toHexString(publicKey.getQ().getEncoded(true));
        this.bucket = Buckets.bucketOf(this.publicKey);
    }

    /**
     * Generate a fresh identity from a {@link SecureRandom}.
     *
     * @return new identity.
     */
    public static SessionIdentity generate()
    {
        return generate(new SecureRandom());
    }

    /**
     * Generate a fresh identity.
     *
     * @param random source of randomness for the key.
     * @return new identity.
     */
    public static SessionIdentity generate(final SecureRandom random)
    {
        final ECKeyPairGenerator generator = new ECKeyPairGenerator();
        generator.init(new ECKeyGenerationParameters(DOMAIN, random));
        final AsymmetricCipherKeyPair keyPair = generator.generateKeyPair();

        return new SessionIdentity(
            (ECPrivateKeyParameters)keyPair.getPrivate(),
            (ECPublicKeyParameters)keyPair.getPublic());
    }

    /**
     * Compressed public key as {@code 0x}-prefixed hex.
     *
     * @return public key string.
     */
    public String publicKey()
    {
        return publicKey;
    }

    /**
     * Bucket derived from {@link #publicKey()}.
     *
     * @return 8 hex character bucket.
     */
    public String bucket()
    {
        return bucket;
    }

    ECPrivateKeyParameters privateKey()
    {
        return privateKey;
    }

    @Override
    public String toString()
    {
        return "SessionIdentity{publicKey=" + publicKey + ", bucket=" + bucket + '}';
    }
}
