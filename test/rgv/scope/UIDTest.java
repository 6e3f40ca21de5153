package rgv.scope;

import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.*;

public class UIDTest {

	@Test
	public void idsAreUniqueAcrossThreads() throws Exception {
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<List<Long>>> batches = new ArrayList<>();
			for (int i = 0; i < 4; i++) {
				batches.add(pool.submit(() -> {
					List<Long> ids = new ArrayList<>();
					for (int j = 0; j < 10000; j++) {
						ids.add(new UID().getId());
					}
					return ids;
				}));
			}
			Set<Long> seen = new HashSet<>();
			for (Future<List<Long>> batch : batches) {
				seen.addAll(batch.get());
			}
			assertEquals(40000, seen.size());
		} finally {
			pool.shutdown();
		}
	}
}
