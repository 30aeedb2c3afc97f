package com.slb.live_backend.modules.wecom.domain;

/**
 * 直播平台接口：分页观看明细与成员/外部联系人查询。
 * 实现不抛出网络异常，失败以错误页或错误码返回。
 */
public interface LivePlatformClient {

    WatchStatPage fetchWatchStat(String livingId, String nextKey);

    ContactLookup lookupUser(String userId);

    ContactLookup lookupExternalContact(String externalUserId);
}
