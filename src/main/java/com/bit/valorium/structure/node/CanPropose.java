package com.bit.valorium.structure.node;

import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.structure.proposal.ProposalRecord;
import com.bit.valorium.structure.tx.Transaction;

import java.util.List;

public interface CanPropose {

    boolean canPropose();

    ProposalRecord propose(HashChain hashChain, List<Transaction> transactions, long timestamp);
}
