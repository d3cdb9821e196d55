package com.example.signage.service.admin.event;

public record DisplayGroupMembershipChangedEvent(Long groupId) {
}
