package info.isaksson.erland.soltouml.core;

import java.io.IOException;

/** Fetches verified source code of a deployed contract from a block explorer. */
public interface ExplorerSourceFetcher {

    /**
     * @param address contract address, {@code 0x}-prefixed
     * @throws IOException if the explorer cannot be reached or has no verified source for the address
     */
    ExplorerSource fetch(String address) throws IOException;
}
