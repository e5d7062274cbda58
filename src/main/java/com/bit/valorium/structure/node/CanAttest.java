package com.bit.valorium.structure.node;

import com.bit.valorium.crypto.CryptoPrimitive;
import com.bit.valorium.structure.node.strategy.AttestationContext;
import com.bit.valorium.structure.proof.Attestation;

import java.util.Optional;

public interface CanAttest {

    boolean canAttest();

    /**
     * 独立推导本轮证明并签名；返回空表示不投票
     */
    Optional<Attestation> attest(AttestationContext context, CryptoPrimitive cryptoPrimitive);
}
