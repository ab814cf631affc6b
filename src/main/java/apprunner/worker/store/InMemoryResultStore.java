package apprunner.worker.store;

import apprunner.common.model.ResultRecord;
import apprunner.worker.repository.ResultStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Result store backed by a concurrent map. Records are lost on restart.
 */
public class InMemoryResultStore implements ResultStore {

    private final ConcurrentMap<String, ResultRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean create(ResultRecord record) {
        return records.putIfAbsent(record.ticket(), record) == null;
    }

    @Override
    public boolean completeIfRunning(ResultRecord terminal) {
        boolean[] replaced = {false};
        records.computeIfPresent(terminal.ticket(), (ticket, current) -> {
            if (current.isTerminal()) {
                return current;
            }
            replaced[0] = true;
            return terminal;
        });
        return replaced[0];
    }

    @Override
    public Optional<ResultRecord> read(String ticket) {
        return Optional.ofNullable(records.get(ticket));
    }

    @Override
    public boolean delete(String ticket) {
        return records.remove(ticket) != null;
    }

    @Override
    public List<ResultRecord> findAll() {
        return new ArrayList<>(records.values());
    }
}
