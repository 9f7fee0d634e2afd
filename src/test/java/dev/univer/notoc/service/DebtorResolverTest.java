package dev.univer.notoc.service;

import dev.univer.notoc.exception.ValidationException;
import dev.univer.notoc.match.Candidate;
import dev.univer.notoc.match.MatchKind;
import dev.univer.notoc.match.Resolution;
import dev.univer.notoc.model.Debtor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class DebtorResolverTest {

    @Autowired private DebtorResolver resolver;
    @Autowired private DebtorService debtorService;
    @Autowired private UserService userService;

    private Long userId;
    private Debtor tuan;
    private Debtor tuanAccented;
    private Debtor minh;

    @BeforeEach
    void setUp() {
        userId = userService.getOrCreate(1001L, "Owner", "owner").getId();
        tuan = debtorService.getOrCreate(userId, "Tuan");
        tuanAccented = debtorService.getOrCreate(userId, "Tu\u1EA5n");
        minh = debtorService.getOrCreate(userId, "Minh");
    }

    @Test
    @DisplayName("Alias wins over a fuzzy-similar name and ignores case")
    void aliasFirst() {
        debtorService.getOrCreate(userId, "Bossa");
        debtorService.addAlias(userId, "Boss", "Minh");

        Resolution r = resolver.resolve(userId, "BOSS");

        assertThat(r.kind()).isEqualTo(MatchKind.ALIAS);
        assertThat(r.exactMatch().getId()).isEqualTo(minh.getId());
        assertThat(r.candidates()).isEmpty();
        assertThat(r.isAmbiguous()).isFalse();
    }

    @Test
    @DisplayName("Exact name keeps diacritics apart")
    void exactNameWithDiacritics() {
        Resolution accented = resolver.resolve(userId, "tu\u1EA5n");
        Resolution plain = resolver.resolve(userId, "  TUAN ");

        assertThat(accented.kind()).isEqualTo(MatchKind.NAME);
        assertThat(accented.exactMatch().getId()).isEqualTo(tuanAccented.getId());
        assertThat(plain.kind()).isEqualTo(MatchKind.NAME);
        assertThat(plain.exactMatch().getId()).isEqualTo(tuan.getId());
    }

    @Test
    @DisplayName("Near miss gives ranked candidates and no auto pick")
    void fuzzyCandidates() {
        Resolution r = resolver.resolve(userId, "Tun");

        assertThat(r.kind()).isEqualTo(MatchKind.FUZZY);
        assertThat(r.isAmbiguous()).isTrue();
        assertThat(r.exact()).isEmpty();
        assertThat(r.candidates()).extracting(c -> c.debtor().getId())
                                  .containsExactly(tuan.getId(), tuanAccented.getId());
        assertThat(r.candidates()).extracting(Candidate::score).allMatch(s -> s >= 60 && s < 100);
    }

    @Test
    @DisplayName("Nothing close enough")
    void none() {
        Resolution r = resolver.resolve(userId, "Zzzz");

        assertThat(r.kind()).isEqualTo(MatchKind.NONE);
        assertThat(r.exact()).isEmpty();
        assertThat(r.candidates()).isEmpty();
    }

    @Test
    @DisplayName("Debtors of other users are invisible")
    void scopedToUser() {
        Long other = userService.getOrCreate(1002L, "Other", null).getId();

        assertThat(resolver.resolve(other, "Tuan").kind()).isEqualTo(MatchKind.NONE);
    }

    @Test
    @DisplayName("Blank name is rejected")
    void blankName() {
        assertThatThrownBy(() -> resolver.resolve(userId, "  ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resolver.resolve(userId, null)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Name-only variant ignores aliases and treats a full score as exact")
    void nameOnly() {
        debtorService.addAlias(userId, "Boss", "Minh");

        assertThat(resolver.resolveByName(userId, "boss", 60).kind()).isEqualTo(MatchKind.NONE);

        Resolution exact = resolver.resolveByName(userId, "minh", 60);
        assertThat(exact.kind()).isEqualTo(MatchKind.NAME);
        assertThat(exact.exactMatch().getId()).isEqualTo(minh.getId());

        assertThat(resolver.resolveByName(userId, "tun", 60).kind()).isEqualTo(MatchKind.FUZZY);
    }
}
