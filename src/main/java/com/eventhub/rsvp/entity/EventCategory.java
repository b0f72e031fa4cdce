package com.eventhub.rsvp.entity;

public enum EventCategory {
    CONFERENCE,
    WORKSHOP,
    MEETUP,
    SEMINAR,
    WEBINAR,
    SOCIAL,
    OTHER
}
