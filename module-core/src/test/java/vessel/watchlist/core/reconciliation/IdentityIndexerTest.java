package vessel.watchlist.core.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static vessel.watchlist.core.reconciliation.VesselFixtures.BLUE;
import static vessel.watchlist.core.reconciliation.VesselFixtures.RED;
import static vessel.watchlist.core.reconciliation.VesselFixtures.vessel;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import vessel.watchlist.core.domain.model.VesselRecord;

@DisplayName("IdentityIndexer")
class IdentityIndexerTest {

  private final IdentityIndexer indexer = new IdentityIndexer();

  @Test
  @DisplayName("키가 없는 레코드는 해당 인덱스에서만 제외된다")
  void recordWithoutImo_isIndexedByMmsiOnly() {
    VesselRecord noImo = vessel(1, "123456789", null, RED);
    VesselRecord emptyMmsi = vessel(2, "", "1234567", BLUE);

    IdentityIndex index = indexer.index(List.of(noImo, emptyMmsi));

    assertThat(index.byMmsi()).containsOnlyKeys("123456789");
    assertThat(index.byImo()).containsOnlyKeys("1234567");
    assertThat(index.byImo().get("1234567")).containsExactly(emptyMmsi);
  }

  @Test
  @DisplayName("키는 처음 등장한 순서, 레코드는 스냅샷 순서를 유지한다")
  void preservesFirstEncounterOrder() {
    VesselRecord a1 = vessel(1, "222222222", null, RED);
    VesselRecord b1 = vessel(2, "111111111", null, RED);
    VesselRecord a2 = vessel(3, "222222222", null, BLUE);

    IdentityIndex index = indexer.index(List.of(a1, b1, a2));

    assertThat(index.byMmsi().keySet()).containsExactly("222222222", "111111111");
    assertThat(index.byMmsi().get("222222222")).containsExactly(a1, a2);
  }

  @Test
  @DisplayName("식별자는 정규화 없이 불투명 문자열로 비교된다")
  void keysAreOpaqueStrings() {
    VesselRecord padded = vessel(1, " 123456789", null, RED);
    VesselRecord plain = vessel(2, "123456789", null, BLUE);
    VesselRecord malformed = vessel(3, "ABC", "12", BLUE);

    IdentityIndex index = indexer.index(List.of(padded, plain, malformed));

    assertThat(index.byMmsi()).containsOnlyKeys(" 123456789", "123456789", "ABC");
    assertThat(index.byImo()).containsOnlyKeys("12");
  }
}
