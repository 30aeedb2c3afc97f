package com.slb.live_backend.modules.wecom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.wecom.domain.ContactLookup;
import com.slb.live_backend.modules.wecom.domain.WatchParticipant;
import com.slb.live_backend.modules.wecom.domain.WatchStatPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 企业微信接口响应解析。观看明细在这里一次性归一化为 {@link WatchParticipant}：
 * <ul>
 *     <li>企业成员 id 取 {@code userid}，外部用户 id 取 {@code external_userid}；</li>
 *     <li>邀请人先取 {@code invitor_userid}（企业成员），再取 {@code invitor_external_userid}（外部用户）；</li>
 *     <li>昵称去除 {@code @微信} 后缀。</li>
 * </ul>
 */
@Component
@Slf4j
public class WeComParser {

    private static final ZoneId BJT = ZoneId.of("Asia/Shanghai");
    private static final String WECHAT_SUFFIX = "@微信";

    private final ObjectMapper objectMapper;

    public WeComParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public WatchStatPage parseWatchStat(String json) {
        if (!StringUtils.hasText(json)) {
            return WatchStatPage.failed(null, "empty watch stat response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception ex) {
            log.warn("WeCom watch stat response is not valid JSON (message={})", ex.getMessage());
            return WatchStatPage.failed(null, "malformed watch stat response");
        }
        int errcode = root.path("errcode").asInt(0);
        if (errcode != 0) {
            return WatchStatPage.failed(errcode, root.path("errmsg").asText("errcode=" + errcode));
        }
        JsonNode statInfo = root.path("stat_info");
        List<WatchParticipant> internal = parseParticipants(statInfo.path("users"), ParticipantKind.INTERNAL);
        List<WatchParticipant> external = parseParticipants(statInfo.path("external_users"), ParticipantKind.EXTERNAL);
        String nextKey = textOrNull(root, "next_key");
        boolean ending = root.path("ending").asInt(0) == 1;
        return new WatchStatPage(internal, external, nextKey, ending, 0, null);
    }

    public ContactLookup parseContact(String json) {
        if (!StringUtils.hasText(json)) {
            return ContactLookup.failed(-1);
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            int errcode = root.path("errcode").asInt(0);
            if (errcode != 0) {
                return ContactLookup.failed(errcode);
            }
            String name = textOrNull(root, "name");
            if (name == null) {
                // externalcontact/get 的名称在 external_contact 节点下
                name = textOrNull(root.path("external_contact"), "name");
            }
            return new ContactLookup(stripWeChatSuffix(name), 0);
        } catch (Exception ex) {
            log.warn("WeCom contact response is not valid JSON (message={})", ex.getMessage());
            return ContactLookup.failed(-1);
        }
    }

    public static int readErrcode(ObjectMapper objectMapper, String json) {
        if (!StringUtils.hasText(json)) {
            return -1;
        }
        try {
            return objectMapper.readTree(json).path("errcode").asInt(0);
        } catch (Exception ex) {
            return -1;
        }
    }

    static String stripWeChatSuffix(String name) {
        if (name != null && name.endsWith(WECHAT_SUFFIX)) {
            return name.substring(0, name.length() - WECHAT_SUFFIX.length());
        }
        return name;
    }

    private List<WatchParticipant> parseParticipants(JsonNode list, ParticipantKind kind) {
        if (list == null || !list.isArray() || list.isEmpty()) {
            return Collections.emptyList();
        }
        List<WatchParticipant> result = new ArrayList<>(list.size());
        for (JsonNode node : list) {
            result.add(parseParticipant(node, kind));
        }
        return result;
    }

    private WatchParticipant parseParticipant(JsonNode node, ParticipantKind kind) {
        String id = kind == ParticipantKind.INTERNAL ? textOrNull(node, "userid") : textOrNull(node, "external_userid");
        String inviterId = textOrNull(node, "invitor_userid");
        ParticipantKind inviterKind = inviterId != null ? ParticipantKind.INTERNAL : null;
        if (inviterId == null) {
            inviterId = textOrNull(node, "invitor_external_userid");
            inviterKind = inviterId != null ? ParticipantKind.EXTERNAL : null;
        }
        JsonNode watchTime = node.path("watch_time");
        int watchSeconds = watchTime.isMissingNode() || watchTime.isNull() ? 0 : watchTime.asInt(-1);
        return new WatchParticipant(
                id,
                kind,
                stripWeChatSuffix(textOrNull(node, "name")),
                watchSeconds,
                node.path("is_comment").asInt(0) == 1,
                node.path("is_mic").asInt(0) == 1,
                epochToTime(node.path("first_enter_time")),
                epochToTime(node.path("last_leave_time")),
                inviterId,
                inviterKind);
    }

    private LocalDateTime epochToTime(JsonNode node) {
        if (node == null || !node.canConvertToLong()) {
            return null;
        }
        long epoch = node.asLong();
        if (epoch <= 0) {
            return null;
        }
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(epoch), BJT);
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return StringUtils.hasText(text) ? text.trim() : null;
    }
}
