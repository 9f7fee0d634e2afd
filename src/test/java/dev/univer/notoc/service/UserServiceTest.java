package dev.univer.notoc.service;

import dev.univer.notoc.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Transactional
class UserServiceTest {

    @Autowired private UserService userService;

    @Test
    @DisplayName("First contact registers, later contacts refresh name and handle")
    void getOrCreate() {
        User first = userService.getOrCreate(8001L, "Lan", "@lan_old");
        User again = userService.getOrCreate(8001L, "Lan N", "lan_new");

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(again.getDisplayName()).isEqualTo("Lan N");
        assertThat(again.getHandle()).isEqualTo("lan_new");
        assertThat(userService.getOrCreate(8002L, "  ", null).getDisplayName()).isEqualTo("Unknown");
    }

    @Test
    @DisplayName("Handle lookup ignores case and the leading @")
    void findByHandle() {
        User lan = userService.getOrCreate(8003L, "Lan", "LanTran");

        assertThat(userService.findByHandle("@lantran")).get().extracting(User::getId).isEqualTo(lan.getId());
        assertThat(userService.findByHandle("nobody")).isEmpty();
        assertThat(userService.findByHandle("@")).isEmpty();
        assertThat(userService.findByHandle(null)).isEmpty();
    }
}
