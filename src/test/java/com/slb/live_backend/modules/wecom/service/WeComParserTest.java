package com.slb.live_backend.modules.wecom.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.wecom.domain.ContactLookup;
import com.slb.live_backend.modules.wecom.domain.WatchParticipant;
import com.slb.live_backend.modules.wecom.domain.WatchStatPage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeComParserTest {

    private final WeComParser parser = new WeComParser(new ObjectMapper());

    @Test
    void shouldNormalizeInternalAndExternalUsers() {
        String json = """
                {"errcode":0,"errmsg":"ok","ending":0,"next_key":"NK2",
                 "stat_info":{
                   "users":[{"userid":"u1","watch_time":120,"is_comment":1,"is_mic":0,
                             "first_enter_time":1700000000,"last_leave_time":1700000600,"invitor_userid":"host1"}],
                   "external_users":[{"external_userid":"e1","name":"张三@微信","watch_time":30,"is_mic":1,
                                      "invitor_external_userid":"e9"},
                                     {"name":"no id","watch_time":5}]
                 }}
                """;

        WatchStatPage page = parser.parseWatchStat(json);

        assertThat(page.isSuccess()).isTrue();
        assertThat(page.nextKey()).isEqualTo("NK2");
        assertThat(page.ending()).isFalse();
        assertThat(page.size()).isEqualTo(3);

        WatchParticipant u1 = page.internalUsers().get(0);
        assertThat(u1.participantId()).isEqualTo("u1");
        assertThat(u1.kind()).isEqualTo(ParticipantKind.INTERNAL);
        assertThat(u1.watchSeconds()).isEqualTo(120);
        assertThat(u1.commented()).isTrue();
        assertThat(u1.usedMic()).isFalse();
        assertThat(u1.firstEnterTime()).isNotNull();
        assertThat(u1.lastEnterTime()).isAfter(u1.firstEnterTime());
        assertThat(u1.inviterId()).isEqualTo("host1");
        assertThat(u1.inviterKind()).isEqualTo(ParticipantKind.INTERNAL);

        WatchParticipant e1 = page.externalUsers().get(0);
        assertThat(e1.participantId()).isEqualTo("e1");
        assertThat(e1.kind()).isEqualTo(ParticipantKind.EXTERNAL);
        assertThat(e1.name()).isEqualTo("张三");
        assertThat(e1.usedMic()).isTrue();
        assertThat(e1.inviterId()).isEqualTo("e9");
        assertThat(e1.inviterKind()).isEqualTo(ParticipantKind.EXTERNAL);

        WatchParticipant missingId = page.externalUsers().get(1);
        assertThat(missingId.participantId()).isNull();
        assertThatThrownBy(missingId::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDefaultMissingWatchTimeAndFlagMalformedOne() {
        String json = """
                {"errcode":0,"ending":1,"next_key":"",
                 "stat_info":{"users":[{"userid":"u1"},{"userid":"u2","watch_time":"abc"}]}}
                """;

        WatchStatPage page = parser.parseWatchStat(json);

        assertThat(page.ending()).isTrue();
        assertThat(page.nextKey()).isNull();
        assertThat(page.externalUsers()).isEmpty();
        assertThat(page.internalUsers().get(0).watchSeconds()).isZero();
        assertThat(page.internalUsers().get(0).hasInviter()).isFalse();
        assertThatThrownBy(() -> page.internalUsers().get(1).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative watch seconds");
    }

    @Test
    void shouldReportErrcodeAsFailedPage() {
        WatchStatPage page = parser.parseWatchStat("{\"errcode\":40014,\"errmsg\":\"invalid access_token\"}");

        assertThat(page.isSuccess()).isFalse();
        assertThat(page.errcode()).isEqualTo(40014);
        assertThat(page.error()).contains("invalid access_token");
        assertThat(parser.parseWatchStat("not json").isSuccess()).isFalse();
        assertThat(parser.parseWatchStat("").isSuccess()).isFalse();
    }

    @Test
    void shouldParseContactNameFromUserAndExternalContact() {
        ContactLookup user = parser.parseContact("{\"errcode\":0,\"userid\":\"u1\",\"name\":\"王五\"}");
        ContactLookup contact = parser.parseContact("{\"errcode\":0,\"external_contact\":{\"name\":\"李四@微信\"}}");
        ContactLookup missing = parser.parseContact("{\"errcode\":60111,\"errmsg\":\"userid not found\"}");

        assertThat(user.isFound()).isTrue();
        assertThat(user.name()).isEqualTo("王五");
        assertThat(contact.name()).isEqualTo("李四");
        assertThat(missing.isFound()).isFalse();
        assertThat(missing.errcode()).isEqualTo(60111);
    }

    @Test
    void shouldReadErrcodeForTokenRetry() {
        ObjectMapper objectMapper = new ObjectMapper();

        assertThat(WeComParser.readErrcode(objectMapper, "{\"errcode\":42001}")).isEqualTo(42001);
        assertThat(WeComParser.readErrcode(objectMapper, "{\"next_key\":\"x\"}")).isZero();
        assertThat(WeComTokenService.isTokenError(42001)).isTrue();
        assertThat(WeComTokenService.isTokenError(40014)).isTrue();
        assertThat(WeComTokenService.isTokenError(60111)).isFalse();
        assertThat(WeComParser.stripWeChatSuffix("赵六@微信")).isEqualTo("赵六");
        assertThat(WeComParser.stripWeChatSuffix(null)).isNull();
    }
}
