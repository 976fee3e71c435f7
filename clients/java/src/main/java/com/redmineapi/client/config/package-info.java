/** Connection settings for a Redmine server and the policies the resource engine applies. */
package com.redmineapi.client.config;
