package apprunner.worker.store;

import apprunner.worker.repository.ResultStore;

class InMemoryResultStoreTest extends ResultStoreContractTest {

    @Override
    protected ResultStore newStore() {
        return new InMemoryResultStore();
    }
}
