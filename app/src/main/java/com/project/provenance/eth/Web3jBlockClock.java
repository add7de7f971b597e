package com.project.provenance.eth;

import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.http.HttpService;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Block clock backed by {@code eth_blockNumber} on a JSON-RPC endpoint.
 *
 * The node may briefly report a lower height after a reorg or when requests
 * are load balanced across nodes; the highest height seen so far is returned
 * in that case.
 */
public class Web3jBlockClock implements BlockClock, Closeable {

    private final Web3j web3;
    private final AtomicLong highestSeen = new AtomicLong(0);

    public Web3jBlockClock(String rpcEndpoint) {
        this(Web3j.build(new HttpService(rpcEndpoint)));
    }

    public Web3jBlockClock(Web3j web3) {
        this.web3 = web3;
    }

    @Override
    public long currentHeight() {
        try {
            EthBlockNumber response = web3.ethBlockNumber().send();
            if (response.hasError()) {
                throw new IllegalStateException("RPC error: " + response.getError().getMessage());
            }
            long reported = response.getBlockNumber().longValueExact();
            return highestSeen.accumulateAndGet(reported, Math::max);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read block height: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        web3.shutdown();
    }
}
