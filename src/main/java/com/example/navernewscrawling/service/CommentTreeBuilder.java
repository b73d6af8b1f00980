package com.example.navernewscrawling.service;

import com.example.navernewscrawling.entity.Comment;
import com.example.navernewscrawling.entity.CommentType;
import com.example.navernewscrawling.entity.DataQualityNote;
import com.example.navernewscrawling.extractor.RawCommentRecord;
import com.example.navernewscrawling.util.DateTimes;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 기사 한 건의 댓글 트리 빌더
 *
 * 페이지 단위로 들어오는 원시 레코드를 받아 2단계(댓글/답글) 트리를 만듭니다.
 * - 사이트 댓글 번호로 중복 제거 (페이지 경계 중복 허용)
 * - 레코드를 처음 받는 순간 순차 ID 부여
 * - 답글의 답글은 최상위 조상 댓글에 붙임
 * - 작성 시각이 없으면 페이지를 받은 시각으로 채우고 노트를 남김
 * - 최상위 댓글의 reply_count = 최종 트리에서 직속 답글 수
 *
 * 한 작업자 스레드에서만 사용합니다. 재시도 시에는 새 인스턴스를 만듭니다.
 */
@Slf4j
public class CommentTreeBuilder {

    private final String url;
    private final IdSequencer sequencer;
    private final OrphanReplyPolicy orphanPolicy;

    /** ID 부여 순서 */
    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, Node> bySiteId = new HashMap<>();
    /** 트리에 넣지 않은 레코드(제외된 고아 답글)까지 포함한 사이트 댓글 번호 */
    private final Set<String> seen = new HashSet<>();
    private final List<DataQualityNote> notes = new ArrayList<>();

    private int duplicates;

    public CommentTreeBuilder(String url, IdSequencer sequencer, OrphanReplyPolicy orphanPolicy) {
        this.url = url;
        this.sequencer = sequencer;
        this.orphanPolicy = orphanPolicy;
    }

    /**
     * 한 페이지 분량의 레코드를 추가합니다.
     *
     * @param records  원시 레코드 (스트림 순서)
     * @param fetchedAt 페이지를 받은 시각 (scraped_at)
     * @return 처음 보는 레코드 수. 중복만 빠지며 번호 없는 레코드와 제외된 고아 답글은 포함합니다.
     */
    public int accept(List<RawCommentRecord> records, LocalDateTime fetchedAt) {
        int fresh = 0;
        for (RawCommentRecord record : records) {
            String siteId = record.getSiteId();
            if (siteId == null || siteId.isBlank()) {
                notes.add(new DataQualityNote(url, DataQualityNote.Kind.MISSING_SITE_ID,
                        "댓글 번호 없는 레코드 제외 (작성자: " + record.getAuthor() + ")"));
                fresh++;
                continue;
            }
            if (!seen.add(siteId)) {
                duplicates++;
                continue;
            }
            fresh++;

            Node topLevel = null;
            if (record.hasParent()) {
                Node parent = bySiteId.get(record.getParentSiteId());
                if (parent == null) {
                    notes.add(new DataQualityNote(url, DataQualityNote.Kind.ORPHAN_REPLY,
                            "부모 댓글 " + record.getParentSiteId() + "을 찾을 수 없는 답글 " + siteId + " (" + orphanPolicy + ")"));
                    if (orphanPolicy == OrphanReplyPolicy.DROP) {
                        continue;
                    }
                } else {
                    topLevel = parent.topLevel != null ? parent.topLevel : parent;
                    if (parent.topLevel != null) {
                        log.debug("답글의 답글 {}을 최상위 댓글 {}에 연결", siteId, topLevel.siteId);
                    }
                }
            }

            String createdAt = DateTimes.normalize(record.getCreatedAt());
            if (createdAt == null) {
                notes.add(new DataQualityNote(url, DataQualityNote.Kind.FIELD_MISSING,
                        "created_at (댓글 " + siteId + ", scraped_at으로 대체)"));
                createdAt = DateTimes.format(fetchedAt);
            }

            Node node = new Node(sequencer.nextCommentId(), siteId, topLevel, record, createdAt, fetchedAt);
            if (topLevel != null) {
                topLevel.replyCount++;
            }
            nodes.add(node);
            bySiteId.put(siteId, node);
        }
        return fresh;
    }

    /**
     * 현재까지 받은 레코드로 댓글 목록을 만듭니다. 순서는 ID 부여 순서입니다.
     */
    public List<Comment> build() {
        List<Comment> comments = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            RawCommentRecord r = node.record;
            boolean reply = node.topLevel != null;
            comments.add(Comment.builder()
                    .commentId(node.commentId)
                    .parentCommentId(reply ? node.topLevel.commentId : null)
                    .commentType(reply ? CommentType.REPLY : CommentType.COMMENT)
                    .siteCommentId(node.siteId)
                    .content(r.getContent())
                    .author(r.getAuthor())
                    .likeCount(r.isDeleted() ? 0 : r.getLikeCount())
                    .dislikeCount(r.isDeleted() ? 0 : r.getDislikeCount())
                    .replyCount(reply ? 0 : node.replyCount)
                    .createdAt(node.createdAt)
                    .scrapedAt(node.fetchedAt)
                    .build());
        }
        return comments;
    }

    public List<DataQualityNote> notes() {
        return List.copyOf(notes);
    }

    public int size() {
        return nodes.size();
    }

    public int duplicatesSkipped() {
        return duplicates;
    }

    private static final class Node {
        private final long commentId;
        private final String siteId;
        /** 답글이면 최상위 조상, 최상위 댓글이면 null */
        private final Node topLevel;
        private final RawCommentRecord record;
        private final String createdAt;
        private final LocalDateTime fetchedAt;
        private int replyCount;

        private Node(long commentId, String siteId, Node topLevel, RawCommentRecord record,
                     String createdAt, LocalDateTime fetchedAt) {
            this.commentId = commentId;
            this.siteId = siteId;
            this.topLevel = topLevel;
            this.record = record;
            this.createdAt = createdAt;
            this.fetchedAt = fetchedAt;
        }
    }
}
